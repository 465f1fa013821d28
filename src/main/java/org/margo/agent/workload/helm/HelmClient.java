/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.helm;

/**
 * Thin facade over a Helm v3 installation. Implementations talk to the cluster the agent manages, tests supply mocks.
 */
public interface HelmClient {

    /**
     * Install a chart as a new release.
     *
     * @param request chart and release to install
     * @throws HelmClientException if the install fails
     */
    void installChart(HelmChartRequest request) throws HelmClientException;

    /**
     * Upgrade an existing release to the chart described by the request.
     *
     * @param request chart and release to upgrade
     * @throws HelmClientException if the upgrade fails
     */
    void upgradeChart(HelmChartRequest request) throws HelmClientException;

    /**
     * Uninstall a release.
     *
     * @param releaseName release to uninstall
     * @param namespace   namespace of the release, null for the default namespace
     * @throws HelmClientException if the uninstall fails
     */
    void uninstallChart(String releaseName, String namespace) throws HelmClientException;

    /**
     * Read the status of a release.
     *
     * @param releaseName release to look up
     * @param namespace   namespace of the release, null for the default namespace
     * @return the status of the release
     * @throws HelmClientException if the release cannot be read
     */
    HelmReleaseStatus getReleaseStatus(String releaseName, String namespace) throws HelmClientException;
}
