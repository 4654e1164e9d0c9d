/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.error;

/**
 * Base type for failures reading XVI export artifacts.
 *
 * Subclasses below this type are recoverable at acquisition granularity:
 * the pipeline records them on the affected session and carries on.
 * {@link PreconditionException} is the only one that aborts a patient.
 */
public class CbctDataException extends Exception {

    public CbctDataException(String message) {
        super(message);
    }

    public CbctDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
