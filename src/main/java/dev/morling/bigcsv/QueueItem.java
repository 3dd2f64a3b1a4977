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

/**
 * One element travelling through a {@link WorkQueue}: either a payload or the end marker.
 * The end marker is a case of its own, so no payload value can ever be mistaken for it.
 */
public sealed interface QueueItem<T> permits QueueItem.Data, QueueItem.End {

    static <T> QueueItem<T> data(T payload) {
        return new Data<>(payload);
    }

    @SuppressWarnings("unchecked")
    static <T> QueueItem<T> end() {
        return (QueueItem<T>) End.INSTANCE;
    }

    default boolean isEnd() {
        return this instanceof End;
    }

    record Data<T>(T payload) implements QueueItem<T> {
    }

    final class End<T> implements QueueItem<T> {

        private static final End<?> INSTANCE = new End<>();

        private End() {
        }

        @Override
        public String toString() {
            return "End";
        }
    }
}
