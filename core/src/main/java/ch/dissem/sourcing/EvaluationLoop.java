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

package ch.dissem.sourcing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static ch.dissem.sourcing.utils.UnixTime.MINUTE;

/**
 * Runs evaluation batches until stopped, waiting in between as long as the evaluator asks for. After each
 * cycle the participants are synchronized and the scores are saved.
 */
class EvaluationLoop implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(EvaluationLoop.class);

    static final long DELAY_AFTER_ERROR = MINUTE;

    private final ValidatorContext ctx;
    private final Object lock = new Object();
    private volatile boolean running = true;

    EvaluationLoop(ValidatorContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void run() {
        LOG.info("Evaluation loop started");
        while (running) {
            long delay;
            try {
                delay = ctx.evaluator().runNextEvalBatch();
                ctx.sync();
                if (delay == 0) {
                    ctx.saveState();
                }
            } catch (RuntimeException e) {
                LOG.error("Error during evaluation", e);
                delay = DELAY_AFTER_ERROR;
            }
            if (delay > 0) {
                LOG.debug("Waiting {} seconds until running the next evaluation batch", delay);
                synchronized (lock) {
                    try {
                        if (running) {
                            lock.wait(delay * 1000);
                        }
                    } catch (InterruptedException e) {
                        LOG.debug("Evaluation loop interrupted");
                        running = false;
                    }
                }
            }
        }
        LOG.info("Evaluation loop stopped");
    }

    boolean isRunning() {
        return running;
    }

    /**
     * Makes the loop stop after the current batch. Doesn't wait for it to finish.
     */
    void stop() {
        running = false;
        synchronized (lock) {
            lock.notifyAll();
        }
    }
}
