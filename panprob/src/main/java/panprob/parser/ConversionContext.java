// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import java.nio.file.Path;

/**
 * What the converter needs to know about the document being converted.
 *
 * @param directory The problem directory, against which {@code \includegraphics} and {@code \inputminted} paths are
 *                  resolved.
 */
public record ConversionContext(Path directory) {
}
