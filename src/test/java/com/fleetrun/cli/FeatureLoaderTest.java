package com.fleetrun.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetrun.core.model.Feature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureLoaderTest {

    @TempDir
    Path dir;

    private final FeatureLoader loader = new FeatureLoader(new ObjectMapper());

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("reads a list of features, ignoring fields it does not know")
        void list() throws IOException {
            Path file = write("features.json", """
                    [{"name":"Login","uri":"login.feature","keyword":"Feature",
                      "background":[{"keyword":"Given","text":"the app is open"}],
                      "scenarios":[
                        {"name":"valid login","tags":["@smoke"],"steps":[{"keyword":"When","text":"I log in","line":4}]},
                        {"name":"login as <user>","steps":[{"keyword":"When","text":"<user> logs in"}],
                         "examples":{"headers":["user"],"rows":[["ann"],["bo"]],
                                     "dataSource":{"type":"csv","source":"users.csv","filter":"role=admin"}}}
                      ]}]""");

            List<Feature> features = loader.load(file);

            assertEquals(1, features.size());
            Feature login = features.get(0);
            assertEquals("Login", login.name());
            assertEquals(1, login.background().size());
            assertEquals(List.of("@smoke"), login.scenarios().get(0).tags());
            var examples = login.scenarios().get(1).examples();
            assertEquals(List.of(List.of("ann"), List.of("bo")), examples.rows());
            assertEquals("users.csv", examples.dataSource().source());
            assertEquals("role=admin", examples.dataSource().filter());
        }

        @Test
        @DisplayName("accepts a wrapper object and a single feature")
        void wrapperAndSingle() throws IOException {
            Path wrapped = write("wrapped.json", """
                    {"features":[{"name":"A","scenarios":[]},{"name":"B","scenarios":[]}]}""");
            Path single = write("single.json", """
                    {"name":"C","scenarios":[{"name":"c1"}]}""");

            assertEquals(List.of("A", "B"), loader.load(wrapped).stream().map(Feature::name).toList());
            assertEquals("c1", loader.load(single).get(0).scenarios().get(0).name());
        }
    }

    @Test
    @DisplayName("reads YAML by extension")
    void yaml() throws IOException {
        Path file = write("features.yml", """
                features:
                  - name: Checkout
                    scenarios:
                      - name: pay by card
                        tags: ["@payments"]
                        steps:
                          - keyword: When
                            text: I pay
                """);

        List<Feature> features = loader.load(file);

        assertEquals("Checkout", features.get(0).name());
        assertEquals("I pay", features.get(0).scenarios().get(0).steps().get(0).text());
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("missing file")
        void missing() {
            var e = assertThrows(FeatureLoadException.class, () -> loader.load(dir.resolve("nope.json")));
            assertTrue(e.getMessage().contains("not found"));
        }

        @Test
        @DisplayName("empty file")
        void empty() throws IOException {
            Path file = write("empty.json", "");

            assertThrows(FeatureLoadException.class, () -> loader.load(file));
        }

        @Test
        @DisplayName("malformed or misshapen content")
        void malformed() throws IOException {
            Path broken = write("broken.json", "{not json");
            Path noFeatures = write("other.json", "{\"tests\":[]}");
            Path wrongShape = write("shape.json", "{\"features\":\"all of them\"}");

            assertThrows(FeatureLoadException.class, () -> loader.load(broken));
            assertThrows(FeatureLoadException.class, () -> loader.load(noFeatures));
            assertThrows(FeatureLoadException.class, () -> loader.load(wrongShape));
        }
    }
}
