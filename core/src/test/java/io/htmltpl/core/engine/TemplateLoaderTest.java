package io.htmltpl.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.htmltpl.core.engine.jslt.JsltExpressionEngine;
import io.htmltpl.core.engine.path.PathExpressionEngine;
import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.error.TemplateSourceException;
import io.htmltpl.core.model.Position;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static Path fixtures() throws URISyntaxException {
        return Path.of(TemplateLoaderTest.class.getClassLoader().getResource("templates").toURI());
    }

    @Test
    void loadsTreeWithSlashNames() throws Exception {
        write("index.html", "<p>home</p>");
        write("users/list.html", "<ul></ul>");
        write("users/deep/item.html", "<li></li>");
        write("notes.txt", "ignored");

        TemplateSet set = new TemplateLoader(tempDir, new PathExpressionEngine()).create();

        assertThat(set.names()).containsExactly("index.html", "users/deep/item.html", "users/list.html");
    }

    @Test
    void customSuffix() throws Exception {
        write("a.tpl", "x");
        write("b.html", "y");

        TemplateSet set = new TemplateLoader(tempDir, ".tpl", new PathExpressionEngine()).create();

        assertThat(set.names()).containsExactly("a.tpl");
    }

    @Test
    void emptyDirectoryGivesEmptySet() {
        assertThat(new TemplateLoader(tempDir, new PathExpressionEngine()).create().size()).isZero();
    }

    @Test
    void compileErrorNamesTheFile() throws Exception {
        write("good.html", "<p>${a}</p>");
        write("sub/broken.html", "<p>\n  ${a..b}</p>");

        assertThatThrownBy(() -> new TemplateLoader(tempDir, new PathExpressionEngine()).create())
                .isInstanceOf(ExpressionCompileException.class)
                .satisfies(e -> {
                    ExpressionCompileException ce = (ExpressionCompileException) e;
                    assertThat(ce.source()).isEqualTo("sub/broken.html");
                    assertThat(ce.position()).isEqualTo(new Position(10, 2, 7));
                });
    }

    @Test
    void missingDirectory() {
        Path missing = tempDir.resolve("nope");

        assertThatThrownBy(() -> new TemplateLoader(missing, new PathExpressionEngine()).create())
                .isInstanceOf(TemplateSourceException.class)
                .hasMessageContaining("does not exist")
                .satisfies(e -> assertThat(((TemplateSourceException) e).source()).isEqualTo(missing.toString()));
    }

    @Test
    void parseCompilesWithLoaderEngine() {
        TemplateLoader loader = new TemplateLoader(tempDir, new JsltExpressionEngine());

        HtmlTemplate template = loader.parse("inline.html", "<b>${.name}</b>");

        assertThat(Renders.renderToString(template, Map.of("name", "Ann"))).isEqualTo("<b>Ann</b>");
    }

    @Test
    void loadsClasspathFixtures() throws Exception {
        TemplateSet set = new TemplateLoader(fixtures(), new PathExpressionEngine()).create();

        assertThat(set.names()).containsExactly("index.html", "users/profile.html");
        assertThat(Renders.renderToString(
                        set.getTemplate("users/profile.html"),
                        Map.of("user", Map.of("id", 7, "name", "Ann & Bob"))))
                .isEqualTo("""
                        <section class="profile" data-id="7">
                          <h1>Ann &amp; Bob</h1>
                          <a href="/users/7/edit">Edit</a>
                        </section>
                        """);
    }
}
