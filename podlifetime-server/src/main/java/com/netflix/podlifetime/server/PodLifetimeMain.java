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

package com.netflix.podlifetime.server;

import java.util.concurrent.CountDownLatch;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Stage;
import com.netflix.podlifetime.common.runtime.internal.DefaultPodLifetimeRuntime;
import com.netflix.podlifetime.common.util.archaius2.Archaius2Ext;
import com.netflix.podlifetime.server.kubernetes.controller.PodLifetimeControllerManager;
import com.sampullara.cli.Args;
import com.sampullara.cli.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PodLifetimeMain {
    private static final Logger logger = LoggerFactory.getLogger(PodLifetimeMain.class);

    @Argument(alias = "p", description = "Specify a properties file")
    private static String propertiesFile;

    public static void main(String[] args) {
        try {
            Args.parse(PodLifetimeMain.class, args);
        } catch (IllegalArgumentException e) {
            Args.usage(PodLifetimeMain.class);
            System.exit(1);
        }

        try {
            Injector injector = Guice.createInjector(
                    Stage.PRODUCTION,
                    new PodLifetimeModule(Archaius2Ext.loadPropertiesFile(propertiesFile))
            );
            PodLifetimeControllerManager controllerManager = injector.getInstance(PodLifetimeControllerManager.class);
            DefaultPodLifetimeRuntime runtime = injector.getInstance(DefaultPodLifetimeRuntime.class);

            CountDownLatch terminated = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down pod lifetime controller");
                controllerManager.shutdown();
                runtime.shutdown();
                terminated.countDown();
            }, "podlifetime-shutdown"));

            controllerManager.start();
            terminated.await();
        } catch (Exception e) {
            // unexpected to get a RuntimeException, will exit
            logger.error("Unexpected error: {}", e.getMessage(), e);
            System.exit(2);
        }
    }
}
