/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.error;

/**
 * A matrix or alignment field does not hold the expected count of numeric values.
 */
public class MalformedMatrixException extends CbctDataException {

    public MalformedMatrixException(String message) {
        super(message);
    }

    public MalformedMatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
