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

import java.util.Scanner;

/**
 * @author Christian Basler
 */
public class CommandLine {
    public static final String ERROR_UNKNOWN_COMMAND = "Unknown command. Please try again.";

    private Scanner scanner = new Scanner(System.in);

    public String nextCommand() {
        return scanner.nextLine().trim().toLowerCase();
    }

    public String nextLineTrimmed() {
        return scanner.nextLine().trim();
    }

    public Integer nextNumber(String question) {
        System.out.println(question);
        try {
            return Integer.parseInt(nextLineTrimmed());
        } catch (NumberFormatException e) {
            System.out.println("Not a number.");
            return null;
        }
    }

    public boolean yesNo(String question) {
        String answer;
        do {
            System.out.println(question + " (y/n)");
            answer = scanner.nextLine();
            if ("y".equalsIgnoreCase(answer)) return true;
            if ("n".equalsIgnoreCase(answer)) return false;
        } while (true);
    }
}
