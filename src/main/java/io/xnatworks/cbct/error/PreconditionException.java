/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.error;

/**
 * The patient root or its acquisition tree is missing. Fatal for the patient run.
 */
public class PreconditionException extends CbctDataException {

    public PreconditionException(String message) {
        super(message);
    }
}
