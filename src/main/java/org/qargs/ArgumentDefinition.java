package org.qargs;

import org.qargs.usage.UsageGroup;

/**
 * A definition of an argument that holds a value: a positional or an option
 * 
 * @param <T> The type of each parsed value
 * @param <U> The type of the accumulated value
 */
public abstract class ArgumentDefinition<T, U> extends Definition implements ValueTarget<T> {
	private final Requirement<U> theRequirement;
	private final ValueParser<T> theParser;
	private final ValuePrinter<T> thePrinter;
	private final Accumulator<T, U> theAccumulator;
	private final Arg<U> theValueHolder;

	ArgumentDefinition(String name, String description, UsageGroup usageGroup, Requirement<U> requirement, ValueParser<T> parser,
		ValuePrinter<T> printer, Accumulator<T, U> accumulator) {
		super(name, description, usageGroup);
		theRequirement = requirement;
		theParser = parser;
		thePrinter = printer;
		theAccumulator = accumulator;
		theValueHolder = requirement.isMandatory() ? new Arg<>(name) : new Arg<>(name, requirement.getDefaultValue());
	}

	/** @return Whether this argument must be given, and its default otherwise */
	public Requirement<U> getRequirement() {
		return theRequirement;
	}

	@Override
	public ValueParser<T> getParser() {
		return theParser;
	}

	/** @return The printer for this argument's values */
	public ValuePrinter<T> getPrinter() {
		return thePrinter;
	}

	/** @return The accumulator merging repeated occurrences of this argument */
	public Accumulator<T, U> getAccumulator() {
		return theAccumulator;
	}

	/** @return The holder receiving this argument's value */
	public Arg<U> getValueHolder() {
		return theValueHolder;
	}

	@Override
	public void fill(T value) {
		theValueHolder.fill(theAccumulator.accumulate(value, theValueHolder.getOrNull()));
		theValueHolder.markGiven();
	}
}
