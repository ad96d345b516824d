/*
 * Copyright 2025 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.podlifetime.server.kubernetes.controller;

import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.podlifetime.runtime.connector.kubernetes.KubeApiFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the pod lifetime controllers to the pod informer, and manages their lifecycle.
 */
@Singleton
public class PodLifetimeControllerManager {

    private static final Logger logger = LoggerFactory.getLogger(PodLifetimeControllerManager.class);

    private final KubeApiFacade kubeApiFacade;
    private final PodLifetimeEventController eventController;
    private final PodLifetimeResyncController resyncController;

    private final Object lock = new Object();
    private boolean started;
    private boolean stopped;

    @Inject
    public PodLifetimeControllerManager(KubeApiFacade kubeApiFacade,
                                        PodLifetimeEventController eventController,
                                        PodLifetimeResyncController resyncController) {
        this.kubeApiFacade = kubeApiFacade;
        this.eventController = eventController;
        this.resyncController = resyncController;
    }

    public void start() {
        synchronized (lock) {
            if (started || stopped) {
                return;
            }
            // Handlers must be registered before the informers start, to observe the initial pod list
            eventController.start();
            resyncController.start();
            kubeApiFacade.startInformers();
            started = true;
        }
        logger.info("Pod lifetime controllers started");
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            resyncController.shutdown();
            eventController.shutdown();
            kubeApiFacade.shutdown();
        }
        logger.info("Pod lifetime controllers stopped");
    }
}
