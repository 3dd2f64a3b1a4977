/*
 *  Copyright 2023 The original authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package dev.morling.bigcsv;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sequential supplier of raw lines, without their terminators. Only ever read by a single
 * thread.
 */
public interface LineSource extends Closeable {

    /**
     * @return the next line, or {@code null} once the input is exhausted
     */
    String readLine() throws IOException;
}
