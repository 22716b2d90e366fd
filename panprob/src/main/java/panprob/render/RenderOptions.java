// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.render;

/**
 * Knobs of {@link HtmlRenderer}.
 *
 * @param embedImages If {@code true}, images are written as base64 {@code data:} URIs, making the output
 *                    self-contained. Otherwise they refer to their file by the path written in the problem source.
 */
public record RenderOptions(boolean embedImages) {
    /**
     * Returns the options used when none are given: images are referenced, not embedded.
     */
    public static RenderOptions defaults() {
        return defaultOptions;
    }

    private static final RenderOptions defaultOptions = new RenderOptions(false);
}
