/*
 * Copyright 2024-2025, The Eligian Authors
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
package eligian.lsp.util;

import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Log messages to the client using the language server protocol.
 *
 * NOTE: Standard output carries the protocol messages, so the
 * language server must never print to it directly. Messages
 * logged before a client is connected are dropped.
 */
public class Logger {

    private static Logger instance;
    private static boolean debugEnabled;

    private LanguageClient client;

    public static boolean isDebugEnabled() {
        return debugEnabled;
    }

    public static void setDebugEnabled(boolean value) {
        debugEnabled = value;
    }

    private Logger() {
    }

    public static Logger getInstance() {
        if( instance == null )
            instance = new Logger();
        return instance;
    }

    /**
     * Connect the logger to a client. Only the first client
     * is kept.
     *
     * @param client
     */
    public void initialize(LanguageClient client) {
        if( this.client == null )
            this.client = client;
    }

    public boolean isInitialized() {
        return client != null;
    }

    public void debug(String message) {
        if( isDebugEnabled() )
            log(MessageType.Log, message);
    }

    public void info(String message) {
        log(MessageType.Info, message);
    }

    public void warn(String message) {
        log(MessageType.Warning, message);
    }

    public void error(String message) {
        log(MessageType.Error, message);
    }

    public void showError(String message) {
        if( client != null )
            client.showMessage(new MessageParams(MessageType.Error, message));
    }

    private void log(MessageType type, String message) {
        if( client != null )
            client.logMessage(new MessageParams(type, message));
    }

}
