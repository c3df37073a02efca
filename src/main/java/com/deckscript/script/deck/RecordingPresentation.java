package com.deckscript.script.deck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * In-memory {@link PresentationBuilder} that records every backend call. Used by the CLI to print
 * a transcript and by tests as the backend double.
 */
public final class RecordingPresentation implements PresentationBuilder {

    private static final ObjectMapper om = new ObjectMapper();

    private final List<RecordedSlide> slides = new ArrayList<>();
    private final List<String> calls = new ArrayList<>();

    @Override
    public Slide addSlide(ObjectNode options) {
        calls.add("addSlide");
        RecordedSlide slide = new RecordedSlide(slides.size(), copy(options));
        slides.add(slide);
        return slide;
    }

    public List<RecordedSlide> slides() {
        return Collections.unmodifiableList(slides);
    }

    /** Backend method names in call order ("addSlide", "addText", ...). */
    public List<String> calls() {
        return Collections.unmodifiableList(calls);
    }

    public int backendCallCount() {
        return calls.size();
    }

    public ObjectNode toJson() {
        ObjectNode root = om.createObjectNode();
        ArrayNode arr = root.putArray("slides");
        for (RecordedSlide s : slides) {
            ObjectNode node = arr.addObject();
            node.set("options", s.options.deepCopy());
            ArrayNode objs = node.putArray("objects");
            for (ObjectNode o : s.objects) objs.add(o.deepCopy());
        }
        return root;
    }

    private static ObjectNode copy(ObjectNode n) {
        return (n == null) ? om.createObjectNode() : n.deepCopy();
    }

    private static JsonNode copy(JsonNode n) {
        return (n == null) ? om.nullNode() : n.deepCopy();
    }

    public final class RecordedSlide implements Slide {
        private final int index;
        private final ObjectNode options;
        private final List<ObjectNode> objects = new ArrayList<>();

        RecordedSlide(int index, ObjectNode options) {
            this.index = index;
            this.options = options;
        }

        public int index() { return index; }
        public ObjectNode options() { return options; }
        public List<ObjectNode> objects() { return Collections.unmodifiableList(objects); }

        @Override
        public void addText(JsonNode text, ObjectNode opts) {
            calls.add("addText");
            ObjectNode o = record("text", opts);
            o.set("text", copy(text));
        }

        @Override
        public void addShape(ShapeType shape, ObjectNode opts) {
            calls.add("addShape");
            ObjectNode o = record("shape", opts);
            o.put("shape", shape.backendName());
        }

        @Override
        public void addImage(ObjectNode opts) {
            calls.add("addImage");
            record("image", opts);
        }

        @Override
        public void addTable(JsonNode rows, ObjectNode opts) {
            if (rows == null || !rows.isArray()) throw new RuntimeException("addTable expects an array of rows");
            calls.add("addTable");
            ObjectNode o = record("table", opts);
            o.set("rows", copy(rows));
        }

        @Override
        public void addChart(ChartType type, JsonNode data, ObjectNode opts) {
            calls.add("addChart");
            ObjectNode o = record("chart", opts);
            o.put("chartType", type.backendName());
            o.set("data", copy(data));
        }

        private ObjectNode record(String kind, ObjectNode opts) {
            ObjectNode o = om.createObjectNode();
            o.put("kind", kind);
            o.set("options", copy(opts));
            objects.add(o);
            return o;
        }
    }
}
