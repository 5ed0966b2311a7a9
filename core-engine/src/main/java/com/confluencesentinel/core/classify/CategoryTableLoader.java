package com.confluencesentinel.core.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Loads and validates a {@link CategoryTable} from YAML.
 *
 * <p>
 * The table is data, not code: operators edit the YAML file and the running
 * service picks it up on reload without a rebuild.
 * </p>
 *
 * @since 1.0.0
 */
public final class CategoryTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CategoryTableLoader.class);

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "categories.yml";

    private CategoryTableLoader() {
    }

    /**
     * @param path path to the YAML file
     * @return validated table
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static CategoryTable fromFile(String path) {
        Objects.requireNonNull(path, "Category table path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Category table not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read category table: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return validated table
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static CategoryTable fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = CategoryTableLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static CategoryTable parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(CategoryTable.class, options));
        CategoryTable table;
        try {
            table = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed category table " + source + ": " + e.getMessage(), e);
        }
        if (table == null) {
            LOG.warn("Category table {} is empty; no instrument will be classified", source);
            table = new CategoryTable();
        }
        table.validate();
        LOG.info("Loaded category table from {}: {}", source, table);
        return table;
    }
}
