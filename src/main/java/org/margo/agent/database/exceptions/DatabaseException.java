/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.database.exceptions;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class DatabaseException extends Exception {
    static final long serialVersionUID = 2381560913487752044L;

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
