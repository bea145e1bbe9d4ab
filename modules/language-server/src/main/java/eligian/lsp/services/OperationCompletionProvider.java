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

import java.util.ArrayList;
import java.util.List;

import eligian.lsp.util.LanguageServerUtils;
import eligian.lsp.util.Logger;
import eligian.script.dsl.OperationRegistry;
import eligian.script.dsl.OperationSignature;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.InsertTextFormat;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;

/**
 * Suggest operations for the identifier being typed.
 */
public class OperationCompletionProvider {

    private static Logger log = Logger.getInstance();

    private final OperationRegistry registry;

    private final int maxItems;

    public OperationCompletionProvider(OperationRegistry registry, int maxItems) {
        this.registry = registry;
        this.maxItems = maxItems;
    }

    public CompletionList completion(String text, Position position) {
        var prefix = LanguageServerUtils.getIdentifierPrefix(text, position);
        log.debug("completion operation -- '" + prefix + "'");
        return completion(prefix);
    }

    /**
     * Get the operations whose name starts with the given prefix,
     * ignoring case. The list is marked incomplete when there are
     * more matches than the configured maximum.
     *
     * @param prefix
     */
    public CompletionList completion(String prefix) {
        var lower = prefix.toLowerCase();
        var items = new ArrayList<CompletionItem>();
        var incomplete = false;
        for( var name : registry.getAllOperationNames() ) {
            if( !name.toLowerCase().startsWith(lower) )
                continue;
            if( items.size() >= maxItems ) {
                incomplete = true;
                break;
            }
            items.add(getCompletionItem(registry.getOperationSignature(name)));
        }
        return new CompletionList(incomplete, items);
    }

    private static CompletionItem getCompletionItem(OperationSignature signature) {
        var item = new CompletionItem(signature.systemName());
        item.setKind(CompletionItemKind.Function);
        item.setDetail(signature.toCallString());
        item.setDocumentation(new MarkupContent(MarkupKind.MARKDOWN, OperationHoverProvider.getDocumentation(signature)));
        item.setInsertText(getSnippet(signature));
        item.setInsertTextFormat(InsertTextFormat.Snippet);
        return item;
    }

    /**
     * Get the insert text of an operation call, with a tab stop
     * for each required parameter.
     *
     * @param signature
     */
    public static String getSnippet(OperationSignature signature) {
        var placeholders = new ArrayList<String>();
        List<String> required = signature.parameters().stream()
            .filter((param) -> param.required())
            .map((param) -> param.name())
            .toList();
        for( int i = 0; i < required.size(); i++ )
            placeholders.add("${" + (i + 1) + ":" + required.get(i) + "}");
        return signature.systemName() + "(" + String.join(", ", placeholders) + ")";
    }

}
