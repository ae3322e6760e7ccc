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

import ch.dissem.sourcing.ini.RewardModelExporter;
import ch.dissem.sourcing.ini.RewardModelImporter;
import ch.dissem.sourcing.repository.JdbcConfig;
import ch.dissem.sourcing.repository.JdbcMinerIndexRepository;
import ch.dissem.sourcing.repository.JdbcScorerStateRepository;
import ch.dissem.sourcing.rewards.RewardDistribution;
import ch.dissem.sourcing.rewards.RewardDistributionModel;
import ch.dissem.sourcing.utils.Property;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import java.io.File;
import java.io.IOException;

public class Main {
    public static void main(String[] args) throws IOException {
        if (System.getProperty("org.slf4j.simpleLogger.defaultLogLevel") == null)
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "ERROR");
        if (System.getProperty("org.slf4j.simpleLogger.logFile") == null)
            System.setProperty("org.slf4j.simpleLogger.logFile", "./validator.log");

        CmdLineOptions options = new CmdLineOptions();
        CmdLineParser parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            return;
        }

        RewardDistributionModel model = options.model == null
            ? RewardDistributionModel.defaultModel()
            : new RewardModelImporter(options.model).getModel();

        if (options.exportModel != null) {
            new RewardModelExporter(model).write(options.exportModel);
            System.out.println("Reward model written to " + options.exportModel);
            return;
        }

        JdbcConfig jdbcConfig = options.db == null ? new JdbcConfig() : new JdbcConfig(options.db, "sa", "");
        StateMaintenance maintenance = new StateMaintenance(
            new JdbcScorerStateRepository(jdbcConfig),
            new JdbcMinerIndexRepository(jdbcConfig),
            new RewardDistribution(model)
        );

        boolean interactive = true;
        if (options.resize != null) {
            maintenance.resize(options.resize);
            interactive = false;
        }
        if (options.reset != null) {
            maintenance.reset(options.reset);
            interactive = false;
        }
        if (options.status) {
            System.out.println(maintenance.status());
            System.out.println(maintenance.scores());
            interactive = false;
        }
        if (options.credible) {
            System.out.println(maintenance.credibleMiners());
            interactive = false;
        }
        if (options.index != null) {
            Property index = maintenance.index(options.index);
            System.out.println(index == null ? "No index stored for " + options.index : index);
            interactive = false;
        }
        if (interactive) {
            new Application(maintenance).run();
        }
    }

    private static class CmdLineOptions {
        @Option(name = "-db", usage = "JDBC URL of the validator database, defaults to ~/sourcing")
        private String db;

        @Option(name = "-model", usage = "Read the reward model from the given INI file instead of using the default one.")
        private File model;

        @Option(name = "-exportModel", usage = "Write the reward model to the given INI file and exit.")
        private File exportModel;

        @Option(name = "-status", usage = "Print the stored scores and credibility of all miners.")
        private boolean status;

        @Option(name = "-credible", usage = "Print the uids of all credible miners.")
        private boolean credible;

        @Option(name = "-reset", usage = "Reset score and credibility of the miner with the given uid.")
        private Integer reset;

        @Option(name = "-resize", usage = "Grow the stored state to the given number of miners.")
        private Integer resize;

        @Option(name = "-index", usage = "Describe the stored index of the miner with the given hotkey.")
        private String index;
    }
}
