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

package dev.mars.actionslint.workflow.building;

import dev.mars.actionslint.core.Problem;

import java.util.List;

/**
 * Tokens of one source plus the problems met while tokenizing. After a syntax error the token
 * list stops at the last complete token.
 */
public record TokenStream(List<YamlToken> tokens, List<Problem> problems) {

    public TokenStream {
        tokens = List.copyOf(tokens);
        problems = List.copyOf(problems);
    }

    public boolean isComplete() {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).isMarker(YamlToken.STREAM_END);
    }
}
