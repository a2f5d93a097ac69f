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

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/// The resource references found in a style document.
///
/// @param sprites sprite base URLs, without ratio or extension
/// @param glyphs the glyph URL template, with `{fontstack}` and `{range}` placeholders, or null
/// @param fontStacks the font stacks used by symbol layers, each joined with commas, in sorted order
/// @param sources the style's sources, in document order
public record StyleReferences(List<String> sprites, String glyphs, Set<String> fontStacks,
                              List<SourceReference> sources) {

    public StyleReferences {
        sprites = List.copyOf(sprites);
        fontStacks = Collections.unmodifiableSet(new TreeSet<>(fontStacks));
        sources = List.copyOf(sources);
    }
}
