package com.marketpulse.core.consolidation;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.AnnotationIntrospector;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.introspect.Annotated;
import com.fasterxml.jackson.databind.introspect.NopAnnotationIntrospector;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.marketpulse.core.model.RawContent;
import com.marketpulse.core.model.RawItem;
import com.marketpulse.core.model.StagePayload;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a payload into a report section, replacing every {@link RawContent}
 * property with derived scalars:
 * <ul>
 *   <li>collection: {@code count}, {@code total_length} and, for {@link RawItem}s, {@code source_ids}</li>
 *   <li>text: {@code length}</li>
 *   <li>map: {@code count}</li>
 *   <li>anything else: {@code present}</li>
 * </ul>
 * Other properties are serialized as they are. The conversion runs on a copy of
 * the application mapper so checkpoints keep the raw content.
 */
@Component
public class RawFieldSummarizer {

    private static final TypeReference<LinkedHashMap<String, Object>> SECTION = new TypeReference<>() {};

    private final ObjectMapper sectionMapper;

    public RawFieldSummarizer(ObjectMapper objectMapper) {
        this.sectionMapper = objectMapper.copy();
        this.sectionMapper.setAnnotationIntrospector(AnnotationIntrospector.pair(new RawContentIntrospector(),
                objectMapper.getSerializationConfig().getAnnotationIntrospector()));
    }

    public Map<String, Object> summarize(StagePayload payload) {
        return sectionMapper.convertValue(payload, SECTION);
    }

    static Map<String, Object> summarizeRaw(Object value) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (value == null) {
            summary.put("present", false);
        } else if (value instanceof Collection<?> items) {
            long totalLength = 0;
            List<String> sourceIds = new ArrayList<>();
            for (Object item : items) {
                if (item instanceof RawItem raw) {
                    totalLength += raw.contentLength();
                    sourceIds.add(raw.sourceId());
                } else if (item instanceof CharSequence text) {
                    totalLength += text.length();
                }
            }
            summary.put("count", items.size());
            summary.put("total_length", totalLength);
            if (!sourceIds.isEmpty()) {
                summary.put("source_ids", sourceIds);
            }
        } else if (value instanceof CharSequence text) {
            summary.put("length", text.length());
        } else if (value instanceof Map<?, ?> map) {
            summary.put("count", map.size());
        } else {
            summary.put("present", true);
        }
        return summary;
    }

    /** Routes {@link RawContent} properties, null or not, to {@link RawSummarySerializer}. */
    private static final class RawContentIntrospector extends NopAnnotationIntrospector {

        @Override
        public Object findSerializer(Annotated a) {
            return a.hasAnnotation(RawContent.class) ? RawSummarySerializer.INSTANCE : null;
        }

        @Override
        public Object findNullSerializer(Annotated a) {
            return a.hasAnnotation(RawContent.class) ? RawSummarySerializer.INSTANCE : null;
        }
    }

    private static final class RawSummarySerializer extends StdSerializer<Object> {

        static final RawSummarySerializer INSTANCE = new RawSummarySerializer();

        private RawSummarySerializer() {
            super(Object.class);
        }

        @Override
        public void serialize(Object value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(summarizeRaw(value), gen);
        }
    }
}
