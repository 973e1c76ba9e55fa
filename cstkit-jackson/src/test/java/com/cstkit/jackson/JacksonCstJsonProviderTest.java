package com.cstkit.jackson;

import com.cstkit.ModuleParser;
import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.PositionProvider;
import com.cstkit.json.CstJsonDeserializer;
import com.cstkit.json.CstJsonException;
import com.cstkit.json.CstJsonProvider;
import com.cstkit.nodes.If;
import com.cstkit.nodes.Module;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonCstJsonProviderTest {

    private final CstJsonProvider provider = new JacksonCstJsonProvider();

    @Test
    @DisplayName("Provider is discovered through ServiceLoader")
    void discoveredByServiceLoader() {
        assertTrue(CstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonCstJsonProvider.class, CstJsonProvider.getProvider());
        assertEquals("Jackson", CstJsonProvider.getProvider("jackson").getName());

        CstJsonException e = assertThrows(CstJsonException.class, () -> CstJsonProvider.getProvider("Gson"));
        assertEquals("No JSON binding named 'Gson'; registered: [Jackson]", e.getMessage());
    }

    @Test
    void serializeResolvedRecordsEveryRequestedProvider() {
        Module module = ModuleParser.parse("pass");

        String json = provider.serializeResolved(module, PositionProvider.BASIC, PositionProvider.SYNTACTIC);

        Map<String, CodeRange> positions = provider.getDeserializer().deserializePositions(json);
        assertEquals(CodeRange.create(1, 0, 1, 4), positions.get("SyntacticPositionProvider"));
        assertTrue(positions.containsKey("BasicPositionProvider"), positions.toString());
    }

    @Test
    void serializationFailureNamesNodeType() {
        ObjectMapper failing = new ObjectMapper() {
            @Override
            public String writeValueAsString(Object value) throws JsonProcessingException {
                throw new JsonMappingException(null, "cannot write");
            }
        };
        CstJsonProvider broken = new JacksonCstJsonProvider(failing);

        CstJsonException e = assertThrows(CstJsonException.class,
            () -> broken.getSerializer().serialize(ModuleParser.parse("a\n")));
        assertEquals("Module", e.nodeType());
        assertEquals("Failed to serialize Module", e.getMessage());
        assertInstanceOf(JsonMappingException.class, e.getCause());
    }

    @Test
    void prettyAndCompactOutputDescribeSameTree() throws Exception {
        Module module = ModuleParser.parse("if a:\n    b; c\nelse:\n    pass\n");
        module.resolvePositions(PositionProvider.SYNTACTIC);

        String compact = provider.getSerializer().serialize(module);
        String pretty = provider.getSerializer().serializePretty(module);

        assertFalse(compact.contains("\n  "));
        assertTrue(pretty.contains("\n  "));
        var mapper = ((JacksonCstJsonProvider) provider).getObjectMapper();
        assertEquals(mapper.readTree(compact), mapper.readTree(pretty));
    }

    @Test
    void readsPositionsOfSerializedNode() {
        Module module = ModuleParser.parse("if a:\n    b\n");
        module.resolvePositions(PositionProvider.BASIC);
        module.resolvePositions(PositionProvider.SYNTACTIC);
        If ifStatement = (If) module.body().get(0);

        Map<String, CodeRange> positions = provider.getDeserializer()
            .deserializePositions(provider.getSerializer().serialize(ifStatement));

        assertEquals(List.of("BasicPositionProvider", "SyntacticPositionProvider"), List.copyOf(positions.keySet()));
        assertEquals(CodeRange.create(1, 0, 1, 5), positions.get("BasicPositionProvider"));
        assertEquals(CodeRange.create(1, 0, 3, 0), positions.get("SyntacticPositionProvider"));
    }

    @Test
    void unrenderedNodeHasNoPositions() {
        Module module = ModuleParser.parse("a\n");
        assertTrue(provider.getDeserializer().deserializePositions(provider.getSerializer().serialize(module)).isEmpty());
    }

    @Test
    void readsRange() {
        CodeRange range = provider.getDeserializer().deserializeRange(
            "{\"start\":{\"line\":1,\"column\":2},\"end\":{\"line\":1,\"column\":5},\"extra\":true}");
        assertEquals(CodeRange.create(1, 2, 1, 5), range);
    }

    @Test
    void rejectsInvalidRanges() {
        CstJsonDeserializer deserializer = provider.getDeserializer();
        assertThrows(CstJsonException.class, () -> deserializer.deserializeRange("not json"));
        assertThrows(CstJsonException.class, () -> deserializer.deserializeRange("[1, 2]"));
        assertThrows(CstJsonException.class,
            () -> deserializer.deserializeRange("{\"start\":{\"line\":1,\"column\":0}}"));
        assertThrows(CstJsonException.class,
            () -> deserializer.deserializeRange("{\"start\":{\"line\":0,\"column\":0},\"end\":{\"line\":1,\"column\":0}}"));
        assertThrows(CstJsonException.class,
            () -> deserializer.deserializeRange("{\"start\":{\"line\":2,\"column\":0},\"end\":{\"line\":1,\"column\":0}}"));
        assertThrows(CstJsonException.class,
            () -> deserializer.deserializeRange("{\"start\":{\"line\":\"x\",\"column\":0},\"end\":{\"line\":1,\"column\":0}}"));
    }

    @Test
    void rejectsMalformedPositions() {
        assertThrows(CstJsonException.class,
            () -> provider.getDeserializer().deserializePositions("{\"type\":\"Name\",\"positions\":[]}"));
        assertThrows(CstJsonException.class,
            () -> provider.getDeserializer().deserializePositions("{"));
    }
}
