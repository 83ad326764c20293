/*
 *  Copyright 2025-present The original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       https://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package plus.wcj.c2flowchart;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import plus.wcj.c2flowchart.extract.CFlowExtractor;
import plus.wcj.c2flowchart.extract.ExtractOptions;
import plus.wcj.c2flowchart.extract.FlowExtractor;
import plus.wcj.c2flowchart.ir.ControlFlowGraph;
import plus.wcj.c2flowchart.ir.Edge;
import plus.wcj.c2flowchart.ir.Node;
import plus.wcj.c2flowchart.ir.NodeType;
import plus.wcj.c2flowchart.render.DiagramRenderer;
import plus.wcj.c2flowchart.render.GraphvizDotRenderer;
import plus.wcj.c2flowchart.render.MermaidFlowchartRenderer;
import plus.wcj.c2flowchart.render.RenderOptions;
import plus.wcj.c2flowchart.render.TextGraphDumper;
import plus.wcj.c2flowchart.settings.C2FlowchartSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "c2flowchart",
        mixinStandardHelpOptions = true,
        version = "c2flowchart 0.1.0",
        description = "Builds the control flow graph of the first C-style function in FILE and prints it.")
public final class C2FlowchartCli implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(C2FlowchartCli.class);

    public enum OutputFormat {
        DUMP,
        DOT,
        MERMAID,
        MARKDOWN
    }

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "FILE",
            description = "Source file to read; stdin when omitted or '-'.")
    @Nullable
    private String input;

    @CommandLine.Option(
            names = {"-f", "--format"},
            description = "Output format: ${COMPLETION-CANDIDATES}. Defaults to the configured output.format.")
    @Nullable
    private OutputFormat format;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout.")
    @Nullable
    private Path output;

    @CommandLine.Option(names = "--direction", description = "Mermaid flow direction, TD or LR.")
    @Nullable
    private String direction;

    @CommandLine.Option(names = "--label-max-length", description = "Truncate diagram labels longer than this.")
    @Nullable
    private Integer labelMaxLength;

    @CommandLine.Option(names = "--keep-comments", description = "Do not strip comments before tokenizing.")
    private boolean keepComments;

    private final FlowExtractor extractor;
    private final InputStream stdin;
    @Nullable
    private final C2FlowchartSettings settings;

    public C2FlowchartCli() {
        this(new CFlowExtractor(), System.in, null);
    }

    C2FlowchartCli(FlowExtractor extractor, InputStream stdin, @Nullable C2FlowchartSettings settings) {
        this.extractor = extractor;
        this.stdin = stdin;
        this.settings = settings;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new C2FlowchartCli()).execute(args));
    }

    static CommandLine commandLine(C2FlowchartCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        C2FlowchartSettings.State state = effectiveSettings().getState();
        if (direction != null) {
            state.setDirection(direction);
        }
        if (labelMaxLength != null) {
            state.setLabelMaxLength(labelMaxLength);
        }
        if (keepComments) {
            state.setStripComments(false);
        }
        OutputFormat outputFormat = format != null ? format : parseFormat(state.getFormat());

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            LOG.error("Failed to read {}", describeInput(), e);
            spec.commandLine().getErr().println("Cannot read " + describeInput() + ": " + e.getMessage());
            return 1;
        }

        ControlFlowGraph graph = extractor.extract(source, ExtractOptions.fromState(state));
        RenderOptions renderOptions;
        try {
            renderOptions = RenderOptions.fromState(state);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        String content = switch (outputFormat) {
            case DUMP -> new TextGraphDumper().render(graph, renderOptions);
            case DOT -> new GraphvizDotRenderer().render(graph, renderOptions);
            case MERMAID -> new MermaidFlowchartRenderer().render(graph, renderOptions);
            case MARKDOWN -> markdown(graph, renderOptions, state);
        };

        try {
            write(content);
        } catch (IOException e) {
            LOG.error("Failed to write {}", output, e);
            spec.commandLine().getErr().println("Cannot write " + output + ": " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private C2FlowchartSettings effectiveSettings() {
        if (settings != null) {
            return settings;
        }
        try {
            return C2FlowchartSettings.getInstance();
        } catch (UncheckedIOException e) {
            LOG.warn("Settings could not be loaded, using built-in defaults", e);
            return C2FlowchartSettings.of(new C2FlowchartSettings.State());
        }
    }

    private OutputFormat parseFormat(String configured) {
        try {
            return OutputFormat.valueOf(configured.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown output.format '{}', falling back to dump", configured);
            return OutputFormat.DUMP;
        }
    }

    private String readSource() throws IOException {
        if (input == null || input.equals("-")) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input), StandardCharsets.UTF_8);
    }

    private void write(String content) throws IOException {
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(content);
            out.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, content, StandardCharsets.UTF_8);
    }

    private String describeInput() {
        return input == null || input.equals("-") ? "stdin" : input;
    }

    private String markdown(ControlFlowGraph graph, RenderOptions renderOptions, C2FlowchartSettings.State state) {
        DiagramRenderer renderer = new MermaidFlowchartRenderer();
        String mermaid = renderer.render(graph, renderOptions);
        long branches = graph.edges().stream().filter(e -> e.condition().isBranch()).count();
        return """
                # %s

                ```mermaid
                %s
                ```

                - Settings
                - nodes: %d
                - edges: %d (%d branch)
                - labelMaxLength: %d
                - direction: %s
                - stripComments: %s
                """.formatted(title(graph), mermaid.stripTrailing(), graph.nodes().size(), graph.edges().size(), branches,
                state.getLabelMaxLength(), renderOptions.direction(), state.isStripComments()).stripTrailing() + "\n";
    }

    private String title(ControlFlowGraph graph) {
        return graph.start()
                .flatMap(start -> graph.outgoing(start.id()).stream().findFirst())
                .map(Edge::target)
                .flatMap(graph::node)
                .filter(n -> n.type() == NodeType.STATEMENT)
                .map(Node::content)
                .map(signature -> signature.replaceAll("\\s*\\{\\s*$", "").replaceAll("\\s+", " ").trim())
                .orElse(input == null || input.equals("-") ? "stdin" : Path.of(input).getFileName().toString());
    }
}
