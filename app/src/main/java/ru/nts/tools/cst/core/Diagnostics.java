/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.cst.core;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Диагностический вывод движка.
 * Отладочные сообщения пишутся в stderr только при CST_DEBUG=true.
 * Если задан CST_LOG_FILE, все сообщения дополнительно пишутся в файл.
 */
public final class Diagnostics {

    /**
     * Флаг включения отладочной информации в stderr.
     */
    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("CST_DEBUG"));

    /**
     * Путь к файлу логов.
     */
    private static final String LOG_FILE = System.getenv("CST_LOG_FILE");
    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, true), true);
            } catch (IOException e) {
                System.err.println("Cannot open log file " + LOG_FILE + ": " + e.getMessage());
            }
        }
    }

    private Diagnostics() {}

    /**
     * Записывает отладочное сообщение.
     */
    public static void log(String message) {
        writeToFile(message);
        if (DEBUG) {
            System.err.println(message);
        }
    }

    /**
     * Записывает предупреждение. Предупреждения выводятся всегда.
     */
    public static void warn(String message, Throwable cause) {
        String line = cause == null ? "Warning: " + message
                : "Warning: " + message + ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        writeToFile(line);
        System.err.println(line);
    }

    private static synchronized void writeToFile(String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] " + message);
        }
    }
}
