package com.cstkit.jackson;

import com.cstkit.codegen.CodeRange;
import com.cstkit.codegen.CodePosition;
import com.cstkit.codegen.PositionProvider;
import com.cstkit.nodes.CstNode;
import com.cstkit.nodes.Else;
import com.cstkit.nodes.If;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonAppend;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.introspect.AnnotatedClass;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.VirtualBeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.util.Annotations;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jackson module that configures serialization for the syntax tree classes.
 *
 * This module handles:
 * - Polymorphic type names via CstNodeMixin
 * - Field-based property detection, since nodes expose record-style accessors
 * - A "positions" property in place of the node metadata (PositionsPropertyWriter)
 * - Range (de)serialization as {start:{line,column}, end:{line,column}}
 * - Sentinel slots written as "DEFAULT"
 */
public class CstModule extends SimpleModule {

    // Fields to exclude from serialization (we write positions instead)
    private static final Set<String> EXCLUDED_FIELDS = Set.of("metadata");

    public CstModule() {
        super("CstModule", new Version(0, 1, 0, "SNAPSHOT", "com.cstkit", "cstkit-jackson"));
        addSerializer(CodeRange.class, new CodeRangeSerializer());
        addDeserializer(CodeRange.class, new CodeRangeDeserializer());
        addSerializer(new MaybeSentinelSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(CstNode.class, CstNodeMixin.class);
        context.setMixInAnnotations(If.class, IfMixin.class);

        // Drop the raw metadata; positions are appended through CstNodeMixin
        context.addBeanSerializerModifier(new CstSerializerModifier());
    }

    // ==================== Serialization Mixins ====================

    // Base mixin: "type" holds the simple class name, properties come from fields
    @JsonAppend(props = @JsonAppend.Prop(value = PositionsPropertyWriter.class, name = "positions"))
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
    private abstract static class CstNodeMixin {
    }

    // Mixin for If - orelse should be included even when null
    private abstract static class IfMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private Else orelse;
    }

    // ==================== Serializer Modifier ====================

    private static class CstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!CstNode.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!EXCLUDED_FIELDS.contains(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }

    /**
     * Virtual property that adds 'positions' to the JSON output from the
     * node's metadata, keyed by provider name. Nothing is written for a node
     * that has not been rendered yet.
     */
    public static class PositionsPropertyWriter extends VirtualBeanPropertyWriter {

        public PositionsPropertyWriter() {
            super();
        }

        protected PositionsPropertyWriter(BeanPropertyDefinition propDef, Annotations contextAnnotations,
                                          JavaType declaredType) {
            super(propDef, contextAnnotations, declaredType);
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            Map<PositionProvider, CodeRange> positions = ((CstNode) bean).metadata().asMap();
            if (positions.isEmpty()) {
                return null;
            }
            Map<String, CodeRange> byName = new LinkedHashMap<>();
            positions.forEach((provider, range) -> byName.put(provider.name(), range));
            return byName;
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new PositionsPropertyWriter(propDef, declaringClass.getAnnotations(), type);
        }
    }

    // ==================== Ranges ====================

    static class CodeRangeSerializer extends StdSerializer<CodeRange> {

        CodeRangeSerializer() {
            super(CodeRange.class);
        }

        @Override
        public void serialize(CodeRange range, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            writePosition(gen, "start", range.start());
            writePosition(gen, "end", range.end());
            gen.writeEndObject();
        }

        private static void writePosition(JsonGenerator gen, String name, CodePosition position) throws IOException {
            gen.writeObjectFieldStart(name);
            gen.writeNumberField("line", position.line());
            gen.writeNumberField("column", position.column());
            gen.writeEndObject();
        }
    }

    static class CodeRangeDeserializer extends StdDeserializer<CodeRange> {

        CodeRangeDeserializer() {
            super(CodeRange.class);
        }

        @Override
        public CodeRange deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            if (tree == null || !tree.isObject()) {
                throw JsonMappingException.from(p, "Expected a range object");
            }
            CodePosition start = readPosition(p, tree, "start");
            CodePosition end = readPosition(p, tree, "end");
            if (end.isBefore(start)) {
                throw JsonMappingException.from(p, "Range ends at " + end + " before it starts at " + start);
            }
            return new CodeRange(start, end);
        }

        private static CodePosition readPosition(JsonParser p, JsonNode tree, String name) throws IOException {
            JsonNode position = tree.get(name);
            if (position == null || !position.isObject()) {
                throw JsonMappingException.from(p, "Missing '" + name + "' position");
            }
            JsonNode line = position.get("line");
            JsonNode column = position.get("column");
            if (line == null || !line.canConvertToInt() || column == null || !column.canConvertToInt()) {
                throw JsonMappingException.from(p, "Position '" + name + "' needs integer 'line' and 'column'");
            }
            try {
                return new CodePosition(line.intValue(), column.intValue());
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Invalid '" + name + "' position: " + e.getMessage(), e);
            }
        }
    }
}
