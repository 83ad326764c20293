/*
 *  Copyright 2025-present The original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       https://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package plus.wcj.c2flowchart.ir;

public enum EdgeCondition {
    TRUE,
    FALSE,
    NONE;

    public boolean isBranch() {
        return this != NONE;
    }

    public String label() {
        return switch (this) {
            case TRUE -> "True";
            case FALSE -> "False";
            case NONE -> "";
        };
    }
}
