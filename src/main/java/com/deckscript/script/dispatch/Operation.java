package com.deckscript.script.dispatch;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The closed table of calls a snippet may make, with their argument specifications.
 * Names are resolved once, by exact match.
 */
public enum Operation {
    ADD_SLIDE("pptx.addSlide", ArgSpec.anyOptional()),
    ADD_TEXT("slide.addText", ArgSpec.any(), ArgSpec.objectRequired()),
    ADD_SHAPE("slide.addShape", ArgSpec.any(), ArgSpec.objectRequired()),
    ADD_IMAGE("slide.addImage", ArgSpec.objectRequired()),
    ADD_TABLE("slide.addTable", ArgSpec.any(), ArgSpec.objectOptional()),
    ADD_CHART("slide.addChart", ArgSpec.enumerated(), ArgSpec.any(), ArgSpec.objectOptional()),
    WRITE_FILE("pptx.writeFile", ArgSpec.anyOptional());

    private static final Set<String> NAMES;
    static {
        Set<String> names = new LinkedHashSet<>();
        for (Operation op : values()) names.add(op.qualifiedName);
        NAMES = Collections.unmodifiableSet(names);
    }

    private final String qualifiedName;
    private final List<ArgSpec> args;

    Operation(String qualifiedName, ArgSpec... args) {
        this.qualifiedName = qualifiedName;
        this.args = Collections.unmodifiableList(Arrays.asList(args));
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public List<ArgSpec> args() {
        return args;
    }

    /** Fewest arguments a call must supply: up to and including the last required one. */
    public int minArgs() {
        int min = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).isRequired()) min = i + 1;
        }
        return min;
    }

    public static Set<String> names() {
        return NAMES;
    }

    /** Null when {@code name} is not whitelisted. */
    public static Operation fromName(String name) {
        for (Operation op : values()) {
            if (op.qualifiedName.equals(name)) return op;
        }
        return null;
    }
}
