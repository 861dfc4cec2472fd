/*
 * Copyright 2025 AxonOps
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

package com.axonops.strsearch.api;

/** Singleton behind {@link Alphabet#unbounded()}. */
final class UnboundedAlphabet implements Alphabet<Object> {
    static final UnboundedAlphabet INSTANCE = new UnboundedAlphabet();

    private UnboundedAlphabet() {
    }

    @Override
    public boolean isBounded() {
        return false;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public int indexOf(Object symbol) {
        throw new UnsupportedOperationException("StrSearch: unbounded alphabet has no symbol index");
    }

    @Override
    public String toString() {
        return "Alphabet[unbounded]";
    }
}
