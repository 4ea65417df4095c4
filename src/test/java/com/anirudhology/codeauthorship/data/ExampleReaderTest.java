package com.anirudhology.codeauthorship.data;

import com.anirudhology.codeauthorship.types.Example;
import com.anirudhology.codeauthorship.types.TokenRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ExampleReaderTest {

    @TempDir
    Path tempDir;

    private Path write(String... lines) throws IOException {
        final Path file = this.tempDir.resolve("tokens.jsonl");
        Files.write(file, List.of(lines));
        return file;
    }

    @Test
    void readsOneExamplePerLine() throws IOException {
        final Path file = write(
                "{\"username\": \"alice\", \"example_id\": \"0\", \"year\": 2008, \"tokens\": [{\"val\": \"def\", \"type\": \"NAME\"}, {\"val\": \":\", \"type\": \"OP\"}]}",
                "{\"username\": \"bob\", \"example_id\": \"1\", \"tokens\": [{\"val\": \"int\"}]}");

        final List<Example> examples = new ExampleReader().read(file);

        assertThat(examples).hasSize(2);
        assertThat(examples.get(0).username()).isEqualTo("alice");
        assertThat(examples.get(0).exampleId()).isEqualTo("0");
        assertThat(examples.get(0).tokens()).containsExactly(new TokenRecord("def", "NAME"), new TokenRecord(":", "OP"));
        assertThat(examples.get(1).tokens()).containsExactly(new TokenRecord("int", null));
    }

    @Test
    void skipsExamplesWithoutTokens() throws IOException {
        final Path file = write(
                "{\"username\": \"alice\", \"example_id\": \"0\", \"tokens\": []}",
                "{\"username\": \"bob\", \"example_id\": \"1\", \"tokens\": [{\"val\": \"x\", \"type\": \"NAME\"}]}");

        assertThat(new ExampleReader().read(file)).extracting(Example::username).containsExactly("bob");
    }

    @Test
    void skipsBlankAndMalformedLines() throws IOException {
        final Path file = write(
                "",
                "not json",
                "null",
                "{\"example_id\": \"0\", \"tokens\": [{\"val\": \"x\"}]}",
                "{\"username\": \"carol\", \"example_id\": \"1\", \"tokens\": [{\"type\": \"NAME\"}]}",
                "{\"username\": \"bob\", \"example_id\": \"2\", \"tokens\": \"oops\"}",
                "{\"username\": \"dave\", \"example_id\": \"3\", \"tokens\": [{\"val\": \"y\", \"type\": \"NAME\"}]}");

        assertThat(new ExampleReader().read(file)).extracting(Example::username).containsExactly("dave");
    }

    @Test
    void skipsNullLiteralLine() throws IOException {
        final Path file = write(
                "null",
                "{\"username\": \"dave\", \"example_id\": \"3\", \"tokens\": [{\"val\": \"y\", \"type\": \"NAME\"}]}");

        assertThat(new ExampleReader().read(file)).extracting(Example::username).containsExactly("dave");
    }

    @Test
    void canReadTheSameFileAgain() throws IOException {
        final Path file = write("{\"username\": \"alice\", \"example_id\": \"0\", \"tokens\": [{\"val\": \"x\"}]}");
        final ExampleReader reader = new ExampleReader();

        assertThat(reader.read(file)).isEqualTo(reader.read(file));
    }

    @Test
    void reportsProgressPerLine() throws IOException {
        final Path file = write(
                "{\"username\": \"alice\", \"example_id\": \"0\", \"tokens\": [{\"val\": \"x\"}]}",
                "{\"username\": \"alice\", \"example_id\": \"1\", \"tokens\": []}");
        final List<Long> reported = new ArrayList<>();

        new ExampleReader(new ObjectMapper(), (stage, processed) -> reported.add(processed)).read(file);

        assertThat(reported).containsExactly(1L, 2L);
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> new ExampleReader().read(this.tempDir.resolve("missing.jsonl")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
