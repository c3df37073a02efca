package com.deckscript.script.deck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The presentation-building backend. The dispatcher is its only caller and hands over options
 * that are already sanitized.
 */
public interface PresentationBuilder {

    /** Adds a slide. {@code options} may carry {@code masterName}; it is never null. */
    Slide addSlide(ObjectNode options);

    interface Slide {
        /** {@code text} is a string or an array of text runs ({text, options}). */
        void addText(JsonNode text, ObjectNode options);

        void addShape(ShapeType shape, ObjectNode options);

        void addImage(ObjectNode options);

        /** {@code rows} is an array of row arrays. */
        void addTable(JsonNode rows, ObjectNode options);

        void addChart(ChartType type, JsonNode data, ObjectNode options);
    }
}
