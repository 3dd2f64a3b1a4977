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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Groups the elements of an iterator into lists of a fixed size. The last list holds the
 * remainder and may be shorter; no list is ever empty.
 */
public final class Batches<T> implements Iterator<List<T>> {

    private final Iterator<T> elements;
    private final int batchSize;

    public Batches(Iterator<T> elements, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.elements = elements;
        this.batchSize = batchSize;
    }

    @Override
    public boolean hasNext() {
        return elements.hasNext();
    }

    @Override
    public List<T> next() {
        if (!elements.hasNext()) {
            throw new NoSuchElementException();
        }
        List<T> batch = new ArrayList<>(Math.min(batchSize, 1024));
        while (batch.size() < batchSize && elements.hasNext()) {
            batch.add(elements.next());
        }
        return batch;
    }

    /**
     * Lines of the source as an iterator. Read failures surface as
     * {@link UncheckedIOException}.
     */
    public static Iterator<String> lines(LineSource source) {
        return new Iterator<>() {
            private String next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next == null && !done) {
                    try {
                        next = source.readLine();
                    }
                    catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    done = next == null;
                }
                return next != null;
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                String line = next;
                next = null;
                return line;
            }
        };
    }

    public static <S, T> Iterator<T> map(Iterator<S> source, Function<S, T> mapper) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public T next() {
                return mapper.apply(source.next());
            }
        };
    }
}
