package org.janelia.decosmic.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utilities for working with JSON parameter and summary data.
 * Only fields are (de)serialized so that value classes can stay immutable and getter free.
 */
public class JsonUtils {

    public static DefaultPrettyPrinter getArraysOnNewLinePrettyPrinter() {
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }

    public static final ObjectMapper FAST_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().
            setDefaultPrettyPrinter(getArraysOnNewLinePrettyPrinter()).
            enable(SerializationFeature.INDENT_OUTPUT);

    /** Rejects unknown properties so that misspelled parameter names in files are reported. */
    public static final ObjectMapper STRICT_MAPPER = MAPPER.copy().
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.valueType = valueType;
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public void toJson(final T value,
                           final Writer writer)
                throws IOException {
            mapper.writeValue(writer, value);
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName() + " json", e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName() + " json", e);
            }
        }

        /**
         * @return value parsed from the specified file.
         *
         * @throws IllegalArgumentException
         *   if the file does not exist, cannot be read, or does not contain valid json.
         */
        public T fromJsonFile(final Path jsonPath)
                throws IllegalArgumentException {

            final Path absolutePath = jsonPath.toAbsolutePath();

            if (! Files.exists(absolutePath)) {
                throw new IllegalArgumentException("json file " + absolutePath + " does not exist");
            }

            if (! Files.isReadable(absolutePath)) {
                throw new IllegalArgumentException("json file " + absolutePath + " is not readable");
            }

            try (final Reader reader = Files.newBufferedReader(absolutePath, StandardCharsets.UTF_8)) {
                return fromJson(reader);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to read " + absolutePath, e);
            }
        }
    }

}
