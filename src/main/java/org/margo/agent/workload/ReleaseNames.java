/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

import java.util.Locale;

public final class ReleaseNames {
    // Helm release names are limited to 53 characters
    public static final int MAX_RELEASE_NAME_LENGTH = 53;
    private static final int SHORT_APP_ID_LENGTH = 8;

    private ReleaseNames() {
    }

    /**
     * Derive the backend release name of one component of a workload: {@code {appId}-{componentName}}. When that is
     * too long, the app id is cut to its first 8 characters and the component name to its trailing characters so the
     * result fits. The name is lower-cased and underscores become dashes.
     *
     * @param appId         workload id
     * @param componentName component name
     * @return release name of at most {@value #MAX_RELEASE_NAME_LENGTH} characters
     */
    public static String generate(String appId, String componentName) {
        String name = appId + "-" + componentName;
        if (name.length() > MAX_RELEASE_NAME_LENGTH) {
            String shortAppId = appId.substring(0, Math.min(SHORT_APP_ID_LENGTH, appId.length()));
            int maxComponentLength = MAX_RELEASE_NAME_LENGTH - shortAppId.length() - 1;
            String shortComponent = componentName.length() > maxComponentLength
                    ? componentName.substring(componentName.length() - maxComponentLength)
                    : componentName;
            name = shortAppId + "-" + shortComponent;
        }
        return name.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
