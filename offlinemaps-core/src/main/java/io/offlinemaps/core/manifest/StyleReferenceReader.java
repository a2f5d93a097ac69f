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

/// Extracts resource references from style and TileJSON documents. Implementations read
/// references only and never evaluate style properties.
public interface StyleReferenceReader {

    /// @param style the style document
    /// @return the references it contains
    /// @throws IllegalArgumentException if the document is not a style
    StyleReferences readStyle(byte[] style);

    /// Completes a source declared by URL with the contents of its TileJSON document.
    /// @param declared the source as declared in the style
    /// @param tileJson the TileJSON document
    /// @return the completed source
    /// @throws IllegalArgumentException if the document is not TileJSON
    SourceReference readTileJson(SourceReference declared, byte[] tileJson);
}
