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
package eligian.script.ir;

import java.util.List;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import eligian.script.dsl.OperationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParameterMapperTest {

    private OperationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = OperationRegistry.getDefault();
    }

    @Test
    void shouldMapPositionalArguments() {
        var signature = registry.getOperationSignature("animate");
        List<JsonElement> args = List.of(JsonValues.asJson(Map.of("opacity", 1)), new JsonPrimitive(200));

        var result = ParameterMapper.mapParameters(signature, args);

        assertTrue(result.isSuccess());
        assertEquals(1, result.operationData().getAsJsonObject("animationProperties").get("opacity").getAsInt());
        assertEquals(200, result.operationData().get("animationDuration").getAsInt());
        assertFalse(result.operationData().has("animationEasing"));
    }

    @Test
    void shouldFillDefaults() {
        var signature = registry.getOperationSignature("selectElement");

        var result = ParameterMapper.mapParameters(signature, List.of(new JsonPrimitive("#title")));

        var data = result.operationData();
        assertEquals("#title", data.get("selector").getAsString());
        assertFalse(data.get("useSelectedElementAsRoot").getAsBoolean());
        assertEquals("selectedElement", data.get("propertyName").getAsString());
    }

    @Test
    void shouldUseDefaultConstantOption() {
        var signature = registry.getOperationSignature("setElementContent");

        var result = ParameterMapper.mapParameters(signature, List.of(new JsonPrimitive("<p>Hi</p>")));

        assertEquals("overwrite", result.operationData().get("insertionType").getAsString());
    }

    @Test
    void shouldReportMissingRequiredParameter() {
        var signature = registry.getOperationSignature("wait");

        var result = ParameterMapper.mapParameters(signature, List.of());

        assertFalse(result.isSuccess());
        var error = result.errors().get(0);
        assertEquals(ParameterMapper.MAPPING_ERROR, error.code());
        assertEquals("milliseconds", error.parameterName());
        assertEquals("Required parameter 'milliseconds' is missing", error.message());
        assertEquals("Provide value for parameter 'milliseconds'", error.hint());
    }

}
