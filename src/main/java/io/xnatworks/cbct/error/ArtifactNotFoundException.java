/*
 * XNAT CBCT Timeline
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.cbct.error;

/**
 * An expected artifact (file, private field, archive member, config key) is missing.
 */
public class ArtifactNotFoundException extends CbctDataException {

    public ArtifactNotFoundException(String message) {
        super(message);
    }
}
