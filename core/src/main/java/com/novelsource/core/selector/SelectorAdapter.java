package com.novelsource.core.selector;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Gson mapping for {@link Selector}.
 * <pre>
 *   "h1.title"                      path
 *   "img.cover@src"                 attribute path
 *   ["h1", "title"]                 fallback list
 *   {"css": "img", "attr": "src"}   explicit form
 *   null / ""                       not available
 * </pre>
 */
public class SelectorAdapter extends TypeAdapter<Selector> {

    @Override
    public void write(JsonWriter out, Selector value) throws IOException {
        if (value == null) {
            out.nullValue();
        } else if (value instanceof PathSelector) {
            out.value(((PathSelector) value).css());
        } else if (value instanceof AttributeSelector) {
            AttributeSelector attr = (AttributeSelector) value;
            out.beginObject();
            out.name("css").value(attr.css());
            out.name("attr").value(attr.attribute());
            out.endObject();
        } else if (value instanceof FallbackSelector) {
            out.beginArray();
            for (Selector alternative : ((FallbackSelector) value).alternatives()) {
                write(out, alternative);
            }
            out.endArray();
        } else {
            throw new JsonParseException("Unknown selector type: " + value.getClass().getName());
        }
    }

    @Override
    public Selector read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        switch (token) {
            case NULL:
                in.nextNull();
                return Selector.NONE;
            case STRING:
                return Selectors.parse(in.nextString());
            case BEGIN_ARRAY: {
                List<Selector> alternatives = new ArrayList<>();
                in.beginArray();
                while (in.hasNext()) {
                    alternatives.add(read(in));
                }
                in.endArray();
                return Selectors.firstOf(alternatives);
            }
            case BEGIN_OBJECT:
                return readObject(in);
            default:
                throw new JsonParseException("Selector must be a string, array or object but was " + token
                        + " at " + in.getPath());
        }
    }

    private Selector readObject(JsonReader in) throws IOException {
        String css = "";
        String attr = null;
        in.beginObject();
        while (in.hasNext()) {
            String key = in.nextName();
            if ("css".equals(key)) {
                css = in.peek() == JsonToken.NULL ? nullToEmpty(in) : in.nextString();
            } else if ("attr".equals(key)) {
                attr = in.peek() == JsonToken.NULL ? nullToEmpty(in) : in.nextString();
            } else {
                in.skipValue();
            }
        }
        in.endObject();
        if (attr == null || attr.isBlank()) {
            return new PathSelector(css);
        }
        return new AttributeSelector(css, attr);
    }

    private static String nullToEmpty(JsonReader in) throws IOException {
        in.nextNull();
        return "";
    }
}
