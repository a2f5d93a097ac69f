package io.offlinemaps.core.manifest;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Gson-based [StyleReferenceReader].
///
/// Font stacks are read from `text-font` layout properties given as a plain array of font
/// names, as a `["literal", [...]]` expression, or as zoom-function stops. Other expressions
/// are not evaluated; a symbol layer with a `text-field` and no `text-font` uses the default
/// stack.
public class JsonStyleReferenceReader implements StyleReferenceReader {

    /// Font stack used by symbol layers that do not name one
    public static final String DEFAULT_FONT_STACK = "Open Sans Regular,Arial Unicode MS Regular";

    @Override
    public StyleReferences readStyle(byte[] style) {
        JsonObject root = parseObject(style, "style");
        if (!root.has("version") || !root.has("sources")) {
            throw new IllegalArgumentException("not a style document: missing version or sources");
        }
        List<String> sprites = new ArrayList<>();
        JsonElement sprite = root.get("sprite");
        if (sprite != null && sprite.isJsonPrimitive()) {
            sprites.add(sprite.getAsString());
        } else if (sprite != null && sprite.isJsonArray()) {
            for (JsonElement element : sprite.getAsJsonArray()) {
                if (element.isJsonObject() && element.getAsJsonObject().has("url")) {
                    sprites.add(element.getAsJsonObject().get("url").getAsString());
                }
            }
        }
        String glyphs = stringOrNull(root, "glyphs");
        Set<String> fontStacks = new LinkedHashSet<>();
        JsonElement layers = root.get("layers");
        if (layers != null && layers.isJsonArray()) {
            for (JsonElement layer : layers.getAsJsonArray()) {
                if (layer.isJsonObject()) {
                    collectFontStacks(layer.getAsJsonObject(), fontStacks);
                }
            }
        }
        List<SourceReference> sources = new ArrayList<>();
        JsonElement sourcesElement = root.get("sources");
        if (!sourcesElement.isJsonObject()) {
            throw new IllegalArgumentException("style sources must be an object");
        }
        for (Map.Entry<String, JsonElement> entry : sourcesElement.getAsJsonObject().entrySet()) {
            if (entry.getValue().isJsonObject()) {
                sources.add(readSource(entry.getKey(), entry.getValue().getAsJsonObject()));
            }
        }
        return new StyleReferences(sprites, glyphs, fontStacks, sources);
    }

    @Override
    public SourceReference readTileJson(SourceReference declared, byte[] tileJson) {
        JsonObject root = parseObject(tileJson, "TileJSON");
        List<String> tiles = strings(root.get("tiles"));
        if (tiles.isEmpty()) {
            throw new IllegalArgumentException("TileJSON for source " + declared.id() + " lists no tiles");
        }
        return declared.withTileJson(
            tiles,
            intOr(root, "minzoom", declared.minZoom()),
            intOr(root, "maxzoom", declared.maxZoom()),
            "tms".equals(stringOrNull(root, "scheme")) || declared.tms()
        );
    }

    private SourceReference readSource(String id, JsonObject source) {
        String type = stringOrNull(source, "type");
        String url = stringOrNull(source, "url");
        if ("geojson".equals(type)) {
            JsonElement data = source.get("data");
            url = data != null && data.isJsonPrimitive() ? data.getAsString() : null;
        }
        return new SourceReference(
            id,
            type,
            url,
            strings(source.get("tiles")),
            intOr(source, "minzoom", SourceReference.DEFAULT_MIN_ZOOM),
            intOr(source, "maxzoom", SourceReference.DEFAULT_MAX_ZOOM),
            "tms".equals(stringOrNull(source, "scheme"))
        );
    }

    private void collectFontStacks(JsonObject layer, Set<String> fontStacks) {
        if (!"symbol".equals(stringOrNull(layer, "type"))) {
            return;
        }
        JsonElement layoutElement = layer.get("layout");
        if (layoutElement == null || !layoutElement.isJsonObject()) {
            return;
        }
        JsonObject layout = layoutElement.getAsJsonObject();
        JsonElement font = layout.get("text-font");
        if (font == null) {
            if (layout.has("text-field")) {
                fontStacks.add(DEFAULT_FONT_STACK);
            }
            return;
        }
        if (font.isJsonArray()) {
            JsonArray array = font.getAsJsonArray();
            if (array.size() == 2 && isString(array.get(0)) && "literal".equals(array.get(0).getAsString())) {
                addStack(array.get(1), fontStacks);
            } else if (isFontList(array)) {
                addStack(array, fontStacks);
            }
        } else if (font.isJsonObject() && font.getAsJsonObject().has("stops")) {
            for (JsonElement stop : font.getAsJsonObject().getAsJsonArray("stops")) {
                if (stop.isJsonArray() && stop.getAsJsonArray().size() == 2) {
                    addStack(stop.getAsJsonArray().get(1), fontStacks);
                }
            }
        }
    }

    private static boolean isFontList(JsonArray array) {
        if (array.size() == 0) {
            return false;
        }
        for (JsonElement element : array) {
            if (!isString(element)) {
                return false;
            }
        }
        // a bare array starting with an operator name is an expression
        String first = array.get(0).getAsString();
        return !first.equals("get") && !first.equals("case") && !first.equals("match")
            && !first.equals("coalesce") && !first.equals("step") && !first.equals("to-string");
    }

    private static void addStack(JsonElement element, Set<String> fontStacks) {
        List<String> fonts = strings(element);
        if (!fonts.isEmpty()) {
            fontStacks.add(String.join(",", fonts));
        }
    }

    private static JsonObject parseObject(byte[] document, String what) {
        try {
            JsonElement root = JsonParser.parseString(new String(document, StandardCharsets.UTF_8));
            if (!root.isJsonObject()) {
                throw new IllegalArgumentException(what + " document is not a JSON object");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException(what + " document is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static List<String> strings(JsonElement element) {
        List<String> values = new ArrayList<>();
        if (element != null && element.isJsonArray()) {
            for (JsonElement value : element.getAsJsonArray()) {
                if (isString(value)) {
                    values.add(value.getAsString());
                }
            }
        }
        return values;
    }

    private static boolean isString(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
    }

    private static String stringOrNull(JsonObject object, String member) {
        JsonElement value = object.get(member);
        return isString(value) ? value.getAsString() : null;
    }

    private static int intOr(JsonObject object, String member, int fallback) {
        JsonElement value = object.get(member);
        if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            return (int) Math.round(value.getAsDouble());
        }
        return fallback;
    }
}
