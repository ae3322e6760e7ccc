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

package ch.dissem.sourcing.demo;

import ch.dissem.sourcing.utils.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static ch.dissem.sourcing.demo.CommandLine.ERROR_UNKNOWN_COMMAND;

/**
 * A simple interactive console to look at and fix the stored validator state.
 */
public class Application {
    private final static Logger LOG = LoggerFactory.getLogger(Application.class);
    private final CommandLine commandLine;
    private final StateMaintenance maintenance;

    public Application(StateMaintenance maintenance) {
        this.maintenance = maintenance;
        this.commandLine = new CommandLine();
    }

    public void run() {
        String command;
        do {
            System.out.println();
            System.out.println("available commands:");
            System.out.println("s) scores");
            System.out.println("c) credible miners");
            System.out.println("i) miner index");
            System.out.println("r) reset miner");
            System.out.println("?) info");
            System.out.println("e) exit");

            command = commandLine.nextCommand();
            try {
                switch (command) {
                    case "s":
                        System.out.println(maintenance.scores());
                        break;
                    case "c":
                        System.out.println(maintenance.credibleMiners());
                        break;
                    case "i":
                        index();
                        break;
                    case "r":
                        reset();
                        break;
                    case "?":
                        System.out.println(maintenance.status());
                        break;
                    case "e":
                        break;
                    default:
                        System.out.println(ERROR_UNKNOWN_COMMAND);
                }
            } catch (IllegalArgumentException e) {
                System.out.println(e.getMessage());
                LOG.debug(e.getMessage(), e);
            }
        } while (!"e".equals(command));
    }

    private void index() {
        System.out.println("Hotkey:");
        String hotkey = commandLine.nextLineTrimmed();
        Property index = maintenance.index(hotkey);
        System.out.println(index == null ? "No index stored for " + hotkey : index);
    }

    private void reset() {
        Integer uid = commandLine.nextNumber("UID of the miner to reset:");
        if (uid != null && commandLine.yesNo("Really reset score and credibility of miner " + uid + "?")) {
            maintenance.reset(uid);
        }
    }
}
