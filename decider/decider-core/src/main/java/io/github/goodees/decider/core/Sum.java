package io.github.goodees.decider.core;

/*-
 * #%L
 * decider-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;
import java.util.function.Function;

/**
 * Tagged union of exactly two variants. Used to route commands and events of a
 * {@linkplain Decider#combine(Decider, Decider) combined decider} to the right half.
 * @param <A> type carried by {@link First}
 * @param <B> type carried by {@link Second}
 */
public abstract class Sum<A, B> {

    private Sum() {
    }

    public static <A, B> Sum<A, B> first(A value) {
        return new First<>(value);
    }

    public static <A, B> Sum<A, B> second(B value) {
        return new Second<>(value);
    }

    /**
     * Exhaustive match over both variants.
     * @param onFirst applied to the value of {@link First}
     * @param onSecond applied to the value of {@link Second}
     * @param <T> result type
     * @return the result of the branch matching this variant
     */
    public abstract <T> T fold(Function<? super A, ? extends T> onFirst, Function<? super B, ? extends T> onSecond);

    public abstract boolean isFirst();

    /**
     * The carried value regardless of the variant.
     * @return the value
     */
    public abstract Object value();

    public static final class First<A, B> extends Sum<A, B> {
        private final A value;

        private First(A value) {
            this.value = Objects.requireNonNull(value, "Value must be specified");
        }

        public A get() {
            return value;
        }

        @Override
        public <T> T fold(Function<? super A, ? extends T> onFirst, Function<? super B, ? extends T> onSecond) {
            return onFirst.apply(value);
        }

        @Override
        public boolean isFirst() {
            return true;
        }

        @Override
        public Object value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof First && value.equals(((First<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 + value.hashCode();
        }

        @Override
        public String toString() {
            return "First(" + value + ')';
        }
    }

    public static final class Second<A, B> extends Sum<A, B> {
        private final B value;

        private Second(B value) {
            this.value = Objects.requireNonNull(value, "Value must be specified");
        }

        public B get() {
            return value;
        }

        @Override
        public <T> T fold(Function<? super A, ? extends T> onFirst, Function<? super B, ? extends T> onSecond) {
            return onSecond.apply(value);
        }

        @Override
        public boolean isFirst() {
            return false;
        }

        @Override
        public Object value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Second && value.equals(((Second<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 37 + value.hashCode();
        }

        @Override
        public String toString() {
            return "Second(" + value + ')';
        }
    }
}
