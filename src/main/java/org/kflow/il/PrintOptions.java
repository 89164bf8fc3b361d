/*
 * Copyright 2025 The Kflow Authors
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

package org.kflow.il;

/**
 * Controls how instructions render blocks and values when printed. The default uses block ids and
 * operand stack positions; {@link GraphPrinter} assigns stable sequential value names instead.
 */
public interface PrintOptions {
  String blockId(BlockEntry block);

  String valueId(Definition definition);

  PrintOptions DEFAULT =
      new PrintOptions() {
        @Override
        public String blockId(BlockEntry block) {
          return "B" + block.blockId();
        }

        @Override
        public String valueId(Definition definition) {
          return definition.hasTempIndex() ? "t" + definition.tempIndex() : "t?";
        }
      };
}
