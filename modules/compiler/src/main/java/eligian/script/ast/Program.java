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
package eligian.script.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed Eligian document.
 *
 * Elements are kept in declaration order.
 */
public record Program(List<ProgramElement> elements) {

    public Program {
        elements = List.copyOf(elements);
    }

    public List<ImportStatement> getImports() {
        return ofType(ImportStatement.class);
    }

    public List<DefaultImport> getDefaultImports() {
        return ofType(DefaultImport.class);
    }

    public List<NamedImport> getNamedImports() {
        return ofType(NamedImport.class);
    }

    public List<ConstDeclaration> getConstants() {
        return ofType(ConstDeclaration.class);
    }

    public List<ActionDefinition> getActions() {
        return ofType(ActionDefinition.class);
    }

    public List<Timeline> getTimelines() {
        return ofType(Timeline.class);
    }

    public ActionDefinition getAction(String name) {
        for( var action : getActions() ) {
            if( action.name().equals(name) )
                return action;
        }
        return null;
    }

    private <T> List<T> ofType(Class<T> type) {
        var result = new ArrayList<T>();
        for( var element : elements ) {
            if( type.isInstance(element) )
                result.add(type.cast(element));
        }
        return result;
    }
}
