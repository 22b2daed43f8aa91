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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.codetree.core.CodeTreeConfig;
import ru.nts.tools.codetree.core.CodeTreeErrorCode;
import ru.nts.tools.codetree.core.CodeTreeException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeTreeCliTest {

    @TempDir
    Path tempDir;

    private Path source;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        source = tempDir.resolve("Sample.cs");
        Files.writeString(source, """
                namespace N
                {
                    class C
                    {
                        int x;
                        int y;
                    }
                }
                """, StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return CodeTreeCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                CodeTreeConfig.lenient());
    }

    private int runFailingBuild(CodeTreeConfig config, String... args) {
        return CodeTreeCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                config,
                path -> {
                    throw new CodeTreeException(CodeTreeErrorCode.UNMAPPED_NODE_KIND,
                            Map.of("tag", "brand_new_member"));
                });
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void listsPathsWithoutQuery() {
        assertEquals(CodeTreeCli.EXIT_OK, run(source.toString()));

        String listing = stdout();
        assertTrue(listing.contains("namespace\tnamespace[N]"));
        assertTrue(listing.contains("namespace/class\tnamespace[N]/class[C]"));
        assertTrue(listing.contains("namespace/class/field[1]\tnamespace[N]/class[C]/field[y]"));
    }

    @Test
    void printsMatchesAsJson() throws IOException {
        assertEquals(CodeTreeCli.EXIT_OK, run(source.toString(), "namespace/class/field"));

        JsonNode json = new ObjectMapper().readTree(stdout());
        assertEquals(2, json.size());
        assertEquals("x", json.get(0).get("name").asText());
        assertEquals("y", json.get(1).get("name").asText());
    }

    @Test
    void noMatch() {
        assertEquals(CodeTreeCli.EXIT_NO_MATCH, run(source.toString(), "namespace/class/method"));
        assertTrue(stderr().contains("No match"));
        assertEquals("", stdout());
    }

    @Test
    void malformedQuery() {
        assertEquals(CodeTreeCli.EXIT_USAGE, run(source.toString(), "class[0/field"));
        assertTrue(stderr().contains("position 5"));
        assertTrue(stderr().contains("unclosed guard"));
    }

    @Test
    void missingFile() {
        assertEquals(CodeTreeCli.EXIT_IO, run(tempDir.resolve("Missing.cs").toString()));
        assertTrue(stderr().contains("Cannot read"));
    }

    @Test
    void usage() {
        assertEquals(CodeTreeCli.EXIT_USAGE, run());
        assertEquals(CodeTreeCli.EXIT_USAGE, run("a", "b", "c"));
        assertTrue(stderr().contains("Usage"));
    }

    @Test
    void buildFailureHasItsOwnExitCode() {
        assertEquals(CodeTreeCli.EXIT_BUILD, runFailingBuild(CodeTreeConfig.strict(), source.toString()));
        assertTrue(stderr().contains("[ERROR: UNMAPPED_NODE_KIND]"));
        assertTrue(stderr().contains("Add 'brand_new_member' to the kind table"));
        assertFalse(stderr().contains("[UNMAPPED_NODE_KIND] "));
        assertEquals("", stdout());
    }

    @Test
    void buildFailureIsLoggedInDebugMode() {
        CodeTreeConfig debug = CodeTreeConfig.builder().strict(true).debug(true).build();
        assertEquals(CodeTreeCli.EXIT_BUILD, runFailingBuild(debug, source.toString(), "class"));
        assertTrue(stderr().contains("[UNMAPPED_NODE_KIND] Parser construct has no node kind | tag=brand_new_member"));
    }

    @Test
    void strictBuildOfBrokenFileSucceeds() throws IOException {
        Path broken = tempDir.resolve("Broken.cs");
        Files.writeString(broken, "class C { void M() { Foo(); ) } }\n", StandardCharsets.UTF_8);
        int code = CodeTreeCli.run(new String[] {broken.toString()},
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                CodeTreeConfig.strict());
        assertEquals(CodeTreeCli.EXIT_OK, code, stderr());
        assertTrue(stdout().contains("error"), stdout());
    }
}
