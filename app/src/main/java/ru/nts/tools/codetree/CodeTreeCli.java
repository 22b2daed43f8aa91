/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.codetree;

import com.fasterxml.jackson.core.JsonProcessingException;
import ru.nts.tools.codetree.core.CodeTreeConfig;
import ru.nts.tools.codetree.core.CodeTreeException;
import ru.nts.tools.codetree.json.TreeJsonWriter;
import ru.nts.tools.codetree.query.QueryParseResult;
import ru.nts.tools.codetree.query.QueryParser;
import ru.nts.tools.codetree.query.StructuralQuery;
import ru.nts.tools.codetree.tree.Node;
import ru.nts.tools.codetree.tree.NodeList;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Command line front end.
 *
 * <pre>
 * codetree &lt;file.cs&gt;          lists the full and alternative path of every node
 * codetree &lt;file.cs&gt; &lt;query&gt;  prints the nodes matched by the query as JSON
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 no node matched the query, 2 bad arguments or query,
 * 3 the file could not be read or the result not rendered, 4 the tree could not be built
 * (a parser failure, or a classification gap in strict mode).
 */
public final class CodeTreeCli {

    static final int EXIT_OK = 0;
    static final int EXIT_NO_MATCH = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_BUILD = 4;

    /**
     * Builds the tree of a file; the seam lets tests supply failing builds.
     */
    @FunctionalInterface
    interface TreeLoader {
        NodeList load(Path path) throws IOException;
    }

    private CodeTreeCli() {}

    public static void main(String[] args) {
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        System.exit(run(args, System.out, System.err, CodeTreeConfig.defaults()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, CodeTreeConfig config) {
        return run(args, out, err, config, path -> CodeTree.fromFile(path, config));
    }

    static int run(String[] args, PrintStream out, PrintStream err, CodeTreeConfig config, TreeLoader loader) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: codetree <file.cs> [query]");
            return EXIT_USAGE;
        }

        QueryParseResult query = null;
        if (args.length == 2) {
            query = QueryParser.standard().tryParse(args[1]);
            if (!query.success()) {
                err.println("Invalid query at position " + query.position() + ": " + query.error());
                return EXIT_USAGE;
            }
        }

        NodeList tree;
        try {
            tree = loader.load(Path.of(args[0]));
        } catch (IOException e) {
            err.println("Cannot read " + args[0] + ": " + e.getMessage());
            return EXIT_IO;
        } catch (CodeTreeException e) {
            if (config.isDebug()) {
                err.println(e.toLogMessage());
            }
            err.println(e.toUserMessage());
            return EXIT_BUILD;
        }

        if (query == null) {
            for (Node node : tree.descendants()) {
                out.println(node.getFullPath() + "\t" + node.getPossibleAlternativePath());
            }
            return EXIT_OK;
        }

        NodeList matches = StructuralQuery.evaluate(tree, query.segments());
        if (matches.isEmpty()) {
            err.println("No match for " + args[1]);
            return EXIT_NO_MATCH;
        }
        try {
            out.println(new TreeJsonWriter().write(matches));
        } catch (JsonProcessingException e) {
            err.println("Cannot render result: " + e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }
}
