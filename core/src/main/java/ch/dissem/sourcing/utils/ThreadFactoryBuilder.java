/*
 * Copyright 2017 Christian Basler
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

package ch.dissem.sourcing.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates thread factories with named threads, so it's easier to see in a thread dump what's going on.
 */
public class ThreadFactoryBuilder {
    private final String namePrefix;
    private int priority = Thread.NORM_PRIORITY;
    private boolean daemon = false;

    private ThreadFactoryBuilder(String pool) {
        this.namePrefix = pool + "-thread-";
    }

    public static ThreadFactoryBuilder pool(String name) {
        return new ThreadFactoryBuilder(name);
    }

    public ThreadFactoryBuilder lowPrio() {
        priority = Thread.MIN_PRIORITY;
        return this;
    }

    public ThreadFactoryBuilder daemon() {
        daemon = true;
        return this;
    }

    public ThreadFactory build() {
        final ThreadGroup group = Thread.currentThread().getThreadGroup();
        final AtomicInteger threadNumber = new AtomicInteger(1);
        return runnable -> {
            Thread t = new Thread(group, runnable, namePrefix + threadNumber.getAndIncrement(), 0);
            t.setPriority(priority);
            t.setDaemon(daemon);
            return t;
        };
    }
}
