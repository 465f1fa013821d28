/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.helm;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class HelmClientException extends Exception {
    static final long serialVersionUID = 4470912860124376012L;

    public HelmClientException(String message) {
        super(message);
    }

    public HelmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
