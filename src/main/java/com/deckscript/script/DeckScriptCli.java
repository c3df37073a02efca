package com.deckscript.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.deckscript.debug.ConsoleDebugSink;
import com.deckscript.debug.Debug;
import com.deckscript.debug.DebugLevel;
import com.deckscript.script.deck.RecordingPresentation;
import com.deckscript.script.dispatch.DispatchDiagnostic;
import com.deckscript.script.safety.SnippetSanitizer;
import com.deckscript.script.safety.UnsafeSnippetException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Runs one snippet file against an in-memory presentation and prints the recorded backend calls
 * as JSON.
 *
 * Exit codes: 0 ok, 1 transcript not renderable, 2 usage, 3 unreadable snippet or invalid config file,
 * 4 unsafe snippet.
 */
public final class DeckScriptCli {

    private static final ObjectMapper om = new ObjectMapper();

    private static final String USAGE = "Usage: DeckScriptCli <snippet-file> [--config file.json] [--strip] [--verbose]";

    public static void main(String[] args) {
        int code = execute(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /** Runs the CLI against the given streams and returns its exit code. */
    public static int execute(String[] args, PrintStream out, PrintStream err) {
        Path snippetPath = null;
        Path configPath = null;
        boolean strip = false;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--config") && i + 1 < args.length) {
                configPath = Path.of(args[++i]);
            } else if (a.equals("--strip")) {
                strip = true;
            } else if (a.equals("--verbose")) {
                verbose = true;
            } else if (!a.startsWith("--") && snippetPath == null) {
                snippetPath = Path.of(a);
            } else {
                err.println(USAGE);
                return 2;
            }
        }
        if (snippetPath == null) {
            err.println(USAGE);
            return 2;
        }

        Debug.get().setSink(new ConsoleDebugSink(err, verbose ? DebugLevel.DEBUG : DebugLevel.WARN));

        final String snippet;
        final DeckScript engine = new DeckScript();
        try {
            snippet = Files.readString(snippetPath, StandardCharsets.UTF_8);
            if (configPath != null) DeckScriptConfig.load(configPath).applyTo(engine);
        } catch (IOException e) {
            err.println("Failed to read file: " + e.getMessage());
            return 3;
        } catch (IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 3;
        }

        String code = strip ? SnippetSanitizer.stripConstructionLines(snippet) : snippet;
        code = engine.inlineResources(code);

        RecordingPresentation deck = new RecordingPresentation();
        try {
            RunResult result = engine.run(code, deck);
            out.println(transcript(deck, result));
            return 0;
        } catch (UnsafeSnippetException e) {
            err.println(e.getMessage());
            return 4;
        } catch (JsonProcessingException e) {
            err.println("Failed to render transcript: " + e.getMessage());
            return 1;
        }
    }

    static String transcript(RecordingPresentation deck, RunResult result) throws JsonProcessingException {
        ObjectNode root = deck.toJson();
        root.put("calls", result.callCount());
        ArrayNode diags = root.putArray("diagnostics");
        for (DispatchDiagnostic d : result.diagnostics()) {
            ObjectNode n = diags.addObject();
            n.put("call", d.callIndex());
            n.put("operation", d.operation());
            n.put("message", d.message());
        }
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    private DeckScriptCli() {}
}
