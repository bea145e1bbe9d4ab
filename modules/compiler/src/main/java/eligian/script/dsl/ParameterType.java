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
package eligian.script.dsl;

/**
 * Semantic parameter type tags declared by the engine's operation metadata.
 */
public enum ParameterType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    SELECTOR("selector"),
    CLASS_NAME("className"),
    HTML_ELEMENT_NAME("htmlElementName"),
    HTML_CONTENT("htmlContent"),
    EVENT_TOPIC("eventTopic"),
    EVENT_NAME("eventName"),
    SYSTEM_NAME("systemName"),
    ACTION_NAME("actionName"),
    CONTROLLER_NAME("controllerName"),
    URL("url"),
    LABEL_ID("labelId"),
    IMAGE_PATH("ImagePath"),
    QUADRANT_POSITION("QuadrantPosition"),
    EXPRESSION("expression"),
    MATH_FUNCTION("mathfunction"),
    DIMENSIONS("dimensions"),
    DIMENSIONS_MODIFIER("dimensionsModifier"),
    CSS_PROPERTIES("cssProperties"),
    ANIMATION_PROPERTIES("animationProperties"),
    JQUERY("jQuery");

    private final String tag;

    ParameterType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Get the parameter type for a metadata tag, or null if the
     * tag is not recognized.
     *
     * @param tag
     */
    public static ParameterType fromTag(String tag) {
        for( var type : values() ) {
            if( type.tag.equals(tag) )
                return type;
        }
        return null;
    }

    @Override
    public String toString() {
        return tag;
    }
}
