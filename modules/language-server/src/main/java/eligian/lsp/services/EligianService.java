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
package eligian.lsp.services;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import eligian.lsp.util.LanguageServerUtils;
import eligian.lsp.util.Logger;
import eligian.script.control.CompilationResult;
import eligian.script.control.Compiler;
import eligian.script.control.CompilerDiagnostic;
import eligian.script.control.CompilerOptions;
import eligian.script.dsl.OperationRegistry;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Language service for Eligian documents. Checks each document
 * when it is opened or changed and publishes the diagnostics,
 * and provides hover hints and completions for operations.
 */
public class EligianService {

    public static final String SOURCE = "eligian";

    public static final String SYNTAX_ERROR = "SYNTAX_ERROR";

    private static Logger log = Logger.getInstance();

    private final ProgramParser parser;

    private final OperationRegistry registry;

    private LanguageClient client;

    private volatile LanguageServerConfiguration configuration = LanguageServerConfiguration.defaults();

    private Compiler compiler;

    private final Map<URI,String> documents = new HashMap<>();

    private final Map<URI,CompilationResult> results = new HashMap<>();

    public EligianService(ProgramParser parser, OperationRegistry registry) {
        this.parser = parser;
        this.registry = registry;
        this.compiler = newCompiler(configuration);
    }

    public EligianService(ProgramParser parser) {
        this(parser, OperationRegistry.getDefault());
    }

    public void connect(LanguageClient client) {
        this.client = client;
        log.initialize(client);
    }

    public LanguageServerConfiguration getConfiguration() {
        return configuration;
    }

    public synchronized void initialize(LanguageServerConfiguration configuration) {
        this.configuration = configuration;
        this.compiler = newCompiler(configuration);
        Logger.setDebugEnabled(configuration.debug());
        for( var uri : documents.keySet() )
            update(uri);
    }

    /**
     * Apply new client settings, re-checking the open documents
     * if the settings affect the diagnostics.
     *
     * @param settings
     */
    public synchronized void didChangeConfiguration(Object settings) {
        var previous = configuration;
        var current = previous.withSettings(settings);
        if( previous.errorReportingMode() != current.errorReportingMode() || previous.typeChecking() != current.typeChecking() ) {
            initialize(current);
        }
        else {
            this.configuration = current;
            Logger.setDebugEnabled(current.debug());
        }
    }

    private Compiler newCompiler(LanguageServerConfiguration configuration) {
        var options = CompilerOptions.defaults().withTypeChecking(configuration.typeChecking());
        return new Compiler(registry, options);
    }

    // -- NOTIFICATIONS

    public synchronized void didOpen(DidOpenTextDocumentParams params) {
        var document = params.getTextDocument();
        var uri = URI.create(document.getUri());
        documents.put(uri, document.getText());
        update(uri);
    }

    public synchronized void didChange(DidChangeTextDocumentParams params) {
        var uri = URI.create(params.getTextDocument().getUri());
        var changes = params.getContentChanges();
        if( changes.isEmpty() )
            return;
        // full document sync: the last change holds the whole text
        documents.put(uri, changes.get(changes.size() - 1).getText());
        update(uri);
    }

    public synchronized void didClose(DidCloseTextDocumentParams params) {
        var uri = URI.create(params.getTextDocument().getUri());
        documents.remove(uri);
        results.remove(uri);
        publish(uri, Collections.emptyList());
    }

    // -- REQUESTS

    public Hover hover(HoverParams params) {
        var text = getText(params.getTextDocument().getUri());
        if( text == null )
            return null;
        return new OperationHoverProvider(registry).hover(text, params.getPosition());
    }

    public Either<List<CompletionItem>,CompletionList> completion(CompletionParams params) {
        var text = getText(params.getTextDocument().getUri());
        if( text == null )
            return Either.forLeft(Collections.emptyList());
        var provider = new OperationCompletionProvider(registry, configuration.maxCompletionItems());
        return Either.forRight(provider.completion(text, params.getPosition()));
    }

    /**
     * Get the result of the last check of a document, or null if
     * the document is not open or could not be parsed.
     *
     * @param uri
     */
    public synchronized CompilationResult getResult(String uri) {
        return results.get(URI.create(uri));
    }

    private synchronized String getText(String uri) {
        return documents.get(URI.create(uri));
    }

    // -- INTERNAL

    private void update(URI uri) {
        var text = documents.get(uri);
        log.debug("update " + uri);

        CompilationResult result;
        try {
            var program = parser.parse(uri, text);
            result = compiler.check(program);
        }
        catch( ParseException e ) {
            results.remove(uri);
            var range = LanguageServerUtils.locationToRange(e.getLocation());
            var diagnostic = new Diagnostic(range, e.getMessage(), DiagnosticSeverity.Error, SOURCE);
            diagnostic.setCode(SYNTAX_ERROR);
            publish(uri, configuration.errorReportingMode() != ErrorReportingMode.OFF ? List.of(diagnostic) : Collections.emptyList());
            return;
        }

        results.put(uri, result);
        for( var name : result.constants().getUnfoldableNames() )
            log.debug("constant '" + name + "' is evaluated at runtime -- " + result.constants().getError(name).reason());

        var diagnostics = new ArrayList<Diagnostic>();
        for( var diagnostic : result.diagnostics() ) {
            if( configuration.errorReportingMode().isRelevant(diagnostic) )
                diagnostics.add(toDiagnostic(diagnostic));
        }
        publish(uri, diagnostics);
    }

    private void publish(URI uri, List<Diagnostic> diagnostics) {
        if( client == null )
            return;
        client.publishDiagnostics(new PublishDiagnosticsParams(uri.toString(), diagnostics));
    }

    /**
     * Convert a compiler diagnostic to an LSP diagnostic. The hint,
     * if any, is appended to the message.
     *
     * @param diagnostic
     */
    public static Diagnostic toDiagnostic(CompilerDiagnostic diagnostic) {
        var range = LanguageServerUtils.locationToRange(diagnostic.location());
        var message = diagnostic.hint() != null
            ? diagnostic.message() + "\n" + diagnostic.hint()
            : diagnostic.message();
        var result = new Diagnostic(range, message, toSeverity(diagnostic.severity()), SOURCE);
        result.setCode(diagnostic.code());
        return result;
    }

    private static DiagnosticSeverity toSeverity(CompilerDiagnostic.Severity severity) {
        switch( severity ) {
            case ERROR:
                return DiagnosticSeverity.Error;
            case WARNING:
                return DiagnosticSeverity.Warning;
            default:
                return DiagnosticSeverity.Information;
        }
    }

}
