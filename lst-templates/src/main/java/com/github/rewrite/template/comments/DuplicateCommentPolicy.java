/*
 * Copyright 2021 - 2023 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.rewrite.template.comments;

/**
 * Which comment {@link CommentCollector} keeps when several matching comments apply to the same
 * line, e.g. a standalone comment on line 4 and an inline comment on line 5.
 * <ul>
 *   <li>{@code LAST_WINS} - the comment visited last in source order is kept (default)</li>
 *   <li>{@code FIRST_WINS} - the comment visited first in source order is kept</li>
 * </ul>
 */
public enum DuplicateCommentPolicy {
    LAST_WINS,
    FIRST_WINS;

    public static DuplicateCommentPolicy fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        try {
            return DuplicateCommentPolicy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
