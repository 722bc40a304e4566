package org.qargs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges a newly parsed value for an argument with the value accumulated from its previous occurrences (or its default)
 * 
 * @param <T> The type of each parsed value
 * @param <U> The type of the accumulated value
 */
@FunctionalInterface
public interface Accumulator<T, U> {
	/**
	 * @param value The newly parsed value
	 * @param previous The previously accumulated value, or the default if this is the first occurrence. May be null.
	 * @return The new accumulated value
	 */
	U accumulate(T value, U previous);

	/**
	 * @param <T> The type of the value
	 * @return An accumulator that keeps only the last value given
	 */
	static <T> Accumulator<T, T> discard() {
		return (value, previous) -> value;
	}

	/**
	 * @param <T> The type of each value
	 * @return An accumulator that collects all values into a list, in the order they were given. The previous list is not modified.
	 */
	static <T> Accumulator<T, List<T>> list() {
		return (value, previous) -> {
			List<T> list = previous == null ? new ArrayList<>() : new ArrayList<>(previous);
			list.add(value);
			return Collections.unmodifiableList(list);
		};
	}

	/**
	 * @param <T> The type of each value
	 * @return An accumulator that collects all distinct values into an insertion-ordered set. The previous set is not modified.
	 */
	static <T> Accumulator<T, Set<T>> set() {
		return (value, previous) -> {
			Set<T> set = previous == null ? new LinkedHashSet<>() : new LinkedHashSet<>(previous);
			set.add(value);
			return Collections.unmodifiableSet(set);
		};
	}

	/**
	 * @return An accumulator for flags that counts the number of times the flag was true, minus the number of times it was false.
	 *         May go negative.
	 */
	static Accumulator<Boolean, Integer> flagCount() {
		return (value, previous) -> (previous == null ? 0 : previous) + (value ? 1 : -1);
	}
}
