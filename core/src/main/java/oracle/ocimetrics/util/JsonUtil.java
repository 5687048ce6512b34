/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.util;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * @hidden
 * JSON helpers on top of the Jackson streaming API. Only the shapes this
 * library exchanges are supported: objects of scalars, objects of such
 * objects, arrays of scalars, and reading the array of a list response.
 */
public class JsonUtil {
    private static final JsonFactory factory = new JsonFactory();

    private JsonUtil() {}

    /**
     * Parses the scalar fields at the top level of a JSON object. Nested
     * objects and arrays are skipped. Numbers and booleans are returned as
     * their text.
     *
     * @param json the JSON text
     * @return the fields in document order
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, String> parseScalarFields(String json) {
        Map<String, String> fields = new LinkedHashMap<>();
        try (JsonParser parser = factory.createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException(
                    "Expected a JSON object: " + LogUtil.truncate(json));
            }
            JsonToken token;
            while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
                String name = parser.getCurrentName();
                token = parser.nextToken();
                if (token == JsonToken.START_OBJECT ||
                    token == JsonToken.START_ARRAY) {
                    parser.skipChildren();
                    continue;
                }
                if (token != JsonToken.VALUE_NULL) {
                    fields.put(name, parser.getText());
                }
            }
            if (token != JsonToken.END_OBJECT) {
                throw new IllegalArgumentException("Truncated JSON object");
            }
        } catch (IOException ioe) {
            throw new IllegalArgumentException(
                "Error parsing JSON: " + ioe.getMessage(), ioe);
        }
        return fields;
    }

    /**
     * Parses an object whose members are objects, such as an exported
     * registry. Member values that are scalars become String, Boolean or
     * Number; nested objects become maps; arrays become lists of scalars.
     *
     * @param json the JSON text
     * @return the members in document order
     * @throws IllegalArgumentException if the text does not have this shape
     */
    public static Map<String, Map<String, Object>> parseObjectOfObjects(
        String json) {

        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        try (JsonParser parser = factory.createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException("Expected a JSON object");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.getCurrentName();
                if (parser.nextToken() != JsonToken.START_OBJECT) {
                    throw new IllegalArgumentException(
                        "Expected an object for member " + name);
                }
                result.put(name, readObject(parser));
            }
        } catch (IOException ioe) {
            throw new IllegalArgumentException(
                "Error parsing JSON: " + ioe.getMessage(), ioe);
        }
        return result;
    }

    /* parser is positioned on START_OBJECT */
    private static Map<String, Object> readObject(JsonParser parser)
        throws IOException {

        Map<String, Object> map = new LinkedHashMap<>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String name = parser.getCurrentName();
            JsonToken token = parser.nextToken();
            map.put(name, readValue(parser, token));
        }
        return map;
    }

    private static Object readValue(JsonParser parser, JsonToken token)
        throws IOException {

        switch (token) {
        case START_OBJECT:
            return readObject(parser);
        case START_ARRAY:
            List<Object> list = new ArrayList<>();
            JsonToken t;
            while ((t = parser.nextToken()) != JsonToken.END_ARRAY) {
                list.add(readValue(parser, t));
            }
            return list;
        case VALUE_TRUE:
            return Boolean.TRUE;
        case VALUE_FALSE:
            return Boolean.FALSE;
        case VALUE_NUMBER_INT:
            return parser.getLongValue();
        case VALUE_NUMBER_FLOAT:
            return parser.getDoubleValue();
        case VALUE_NULL:
            return null;
        default:
            return parser.getText();
        }
    }

    /**
     * Counts the elements of the array in a response: either the top level
     * array of a REST response or the "data" array of a command line
     * response.
     *
     * @param json the JSON text, may be null or empty
     * @return the number of elements, 0 if there is no such array
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static int countDataElements(String json) {
        if (json == null || json.trim().isEmpty()) {
            return 0;
        }
        try (JsonParser parser = factory.createParser(json)) {
            return findDataArray(parser) ? countArray(parser) : 0;
        } catch (IOException ioe) {
            throw new IllegalArgumentException(
                "Error parsing JSON: " + ioe.getMessage(), ioe);
        }
    }

    /**
     * Collects a string field of every object in the array of a response,
     * located as in {@link #countDataElements(String)}. Elements that are
     * not objects or lack the field are skipped.
     *
     * @param json the JSON text, may be null or empty
     * @param field the field name, e.g. "id"
     * @return the values in document order
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static List<String> collectDataField(String json, String field) {
        List<String> values = new ArrayList<>();
        if (json == null || json.trim().isEmpty()) {
            return values;
        }
        try (JsonParser parser = factory.createParser(json)) {
            if (!findDataArray(parser)) {
                return values;
            }
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token != JsonToken.START_OBJECT) {
                    parser.skipChildren();
                    continue;
                }
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    String name = parser.getCurrentName();
                    token = parser.nextToken();
                    if (field.equals(name) &&
                        token == JsonToken.VALUE_STRING) {
                        values.add(parser.getText());
                    } else {
                        parser.skipChildren();
                    }
                }
            }
        } catch (IOException ioe) {
            throw new IllegalArgumentException(
                "Error parsing JSON: " + ioe.getMessage(), ioe);
        }
        return values;
    }

    /*
     * Positions the parser on the START_ARRAY of the top level array or of
     * the "data" member. Returns false if there is neither.
     */
    private static boolean findDataArray(JsonParser parser)
        throws IOException {

        JsonToken token = parser.nextToken();
        if (token == JsonToken.START_ARRAY) {
            return true;
        }
        if (token != JsonToken.START_OBJECT) {
            return false;
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String name = parser.getCurrentName();
            token = parser.nextToken();
            if ("data".equals(name) && token == JsonToken.START_ARRAY) {
                return true;
            }
            parser.skipChildren();
        }
        return false;
    }

    private static int countArray(JsonParser parser) throws IOException {
        int count = 0;
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            parser.skipChildren();
            count++;
        }
        return count;
    }

    /**
     * Writes a map as a JSON object. Values may be null, String, Number,
     * Boolean, Map or Collection; anything else is written as its string
     * form.
     *
     * @param map the map
     * @param pretty true to indent the output
     * @return the JSON text
     */
    public static String toJson(Map<String, ?> map, boolean pretty) {
        StringWriter sw = new StringWriter();
        try (JsonGenerator gen = factory.createGenerator(sw)) {
            if (pretty) {
                gen.useDefaultPrettyPrinter();
            }
            writeValue(gen, map);
        } catch (IOException ioe) {
            throw new IllegalStateException(
                "Error writing JSON: " + ioe.getMessage(), ioe);
        }
        return sw.toString();
    }

    private static void writeValue(JsonGenerator gen, Object value)
        throws IOException {

        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                gen.writeFieldName(String.valueOf(e.getKey()));
                writeValue(gen, e.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof Collection) {
            gen.writeStartArray();
            for (Object o : (Collection<?>) value) {
                writeValue(gen, o);
            }
            gen.writeEndArray();
        } else if (value instanceof Boolean) {
            gen.writeBoolean((Boolean) value);
        } else if (value instanceof Integer || value instanceof Long) {
            gen.writeNumber(((Number) value).longValue());
        } else if (value instanceof Number) {
            gen.writeNumber(((Number) value).doubleValue());
        } else {
            gen.writeString(value.toString());
        }
    }
}
