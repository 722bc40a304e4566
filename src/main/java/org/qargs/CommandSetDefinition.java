package org.qargs;

/**
 * Marks an {@link ArgumentSet} as requiring exactly one of its commands, and holds the identifier of the selected command
 * 
 * @param <T> The type of the command identifiers
 */
public final class CommandSetDefinition<T> implements ValueTarget<T> {
	private final ValueParser<T> theParser;
	private final ValuePrinter<T> thePrinter;
	private final ValueHolder<T> theValueHolder;

	CommandSetDefinition(ValueParser<T> parser, ValuePrinter<T> printer) {
		theParser = parser;
		thePrinter = printer;
		theValueHolder = new ValueHolder<>();
	}

	@Override
	public String getName() {
		return "command";
	}

	@Override
	public ValueParser<T> getParser() {
		return theParser;
	}

	/** @return The printer producing the name of each command from its identifier */
	public ValuePrinter<T> getPrinter() {
		return thePrinter;
	}

	/** @return The holder of the selected command's identifier, empty until a command is parsed */
	public ValueHolder<T> getValueHolder() {
		return theValueHolder;
	}

	/** @return The name of the selected command, or null if none has been selected */
	public String printSelected() {
		return theValueHolder.isFilled() ? thePrinter.print(theValueHolder.get()) : null;
	}

	@Override
	public void fill(T value) {
		theValueHolder.fill(value);
	}
}
