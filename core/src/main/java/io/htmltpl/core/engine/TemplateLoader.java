package io.htmltpl.core.engine;

import io.htmltpl.core.error.TemplateSourceException;
import io.htmltpl.core.html.MarkupScanner;
import io.htmltpl.core.html.ValueTokenizer;
import io.htmltpl.core.spi.ExpressionEngine;
import io.htmltpl.core.spi.TemplateFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles every template file under a directory into a {@link TemplateSet}.
 *
 * <p>Files are found recursively and kept when their name ends with the suffix. A template's name
 * is its path relative to the directory, with {@code /} separators ({@code users/list.html}).
 * Files are read as UTF-8 and compiled in name order, so the first broken file reported is
 * always the same one.
 *
 * <p>Also usable directly as the {@link TemplateFactory} of an {@link HtmlRenderer}: every {@link
 * #create()} reads the directory again.
 */
public final class TemplateLoader implements TemplateFactory {

    /** Suffix used when none is configured. */
    public static final String DEFAULT_SUFFIX = ".html";

    private static final Logger LOG = LoggerFactory.getLogger(TemplateLoader.class);

    private final Path directory;
    private final String suffix;
    private final MarkupScanner scanner;

    public TemplateLoader(Path directory, ExpressionEngine engine) {
        this(directory, DEFAULT_SUFFIX, engine);
    }

    public TemplateLoader(Path directory, String suffix, ExpressionEngine engine) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.scanner = new MarkupScanner(new ValueTokenizer(Objects.requireNonNull(engine, "engine")));
    }

    public Path directory() {
        return directory;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Loads and compiles all templates.
     *
     * @return a new set
     * @throws TemplateSourceException if the directory or a file cannot be read
     * @throws io.htmltpl.core.error.ExpressionCompileException if a template does not compile; its
     *     {@code source()} is the template name
     */
    @Override
    public TemplateSet create() {
        List<Path> files = templateFiles();
        TemplateSet.Builder builder = TemplateSet.builder();
        for (Path file : files) {
            String name = nameOf(file);
            builder.add(parse(name, read(file, name)));
            LOG.debug("Compiled template: name={}, file={}", name, file);
        }
        TemplateSet set = builder.build();
        LOG.info("Loaded {} template(s) from {}", set.size(), directory);
        return set;
    }

    /**
     * Compiles one template from source, with this loader's expression engine.
     *
     * @throws io.htmltpl.core.error.ExpressionCompileException if the source does not compile
     */
    public HtmlTemplate parse(String name, String source) {
        return HtmlTemplate.compile(name, source, scanner);
    }

    private List<Path> templateFiles() {
        if (!Files.isDirectory(directory)) {
            throw new TemplateSourceException("Template directory does not exist: " + directory, directory.toString());
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted((a, b) -> nameOf(a).compareTo(nameOf(b)))
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new TemplateSourceException(
                    "Failed to list templates in " + directory + ": " + e.getMessage(), e, directory.toString());
        }
    }

    private String nameOf(Path file) {
        return directory.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    private static String read(Path file, String name) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateSourceException("Failed to read template " + file + ": " + e.getMessage(), e, name);
        }
    }
}
