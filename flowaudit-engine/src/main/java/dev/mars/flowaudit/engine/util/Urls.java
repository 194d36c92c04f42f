/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowaudit.engine.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL checks used by the configuration rules. Nothing here touches the network.
 */
public final class Urls {

    private Urls() {
    }

    /**
     * A URL containing a {@code {{...}}} placeholder is resolved by the platform at run time and
     * cannot be judged statically.
     */
    public static boolean isTemplated(String url) {
        return url.contains("{{");
    }

    /**
     * True when the URL parses, is absolute and names a host. Registry-based authorities such as
     * {@code hooks_api.example.com} leave {@link URI#getHost()} null but still count.
     */
    public static boolean isValid(String url) {
        return parse(url)
                .filter(URI::isAbsolute)
                .filter(uri -> uri.getHost() != null || uri.getRawAuthority() != null)
                .isPresent();
    }

    /**
     * True when the URL points at the local machine and is therefore unreachable from the
     * platform's servers. Unparseable URLs are checked textually.
     */
    public static boolean isLoopback(String url) {
        Optional<String> host = parse(url).map(URI::getHost).map(h -> h.toLowerCase(Locale.ROOT));
        if (host.isPresent()) {
            String h = host.get();
            return h.equals("localhost")
                    || h.endsWith(".localhost")
                    || h.startsWith("127.")
                    || h.equals("0.0.0.0")
                    || h.equals("[::1]")
                    || h.equals("::1");
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.contains("localhost") || lower.contains("127.0.0.1") || lower.contains("0.0.0.0");
    }

    private static Optional<URI> parse(String url) {
        try {
            return Optional.of(new URI(url.trim()));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
