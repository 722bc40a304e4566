package org.qargs;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Parses command-line tokens against one scope's {@link ArgumentSet}, filling the registered value holders. When a command is
 * matched, the rest of the tokens are parsed against that command's arguments.
 */
public final class ParserContext {
	private static final Logger log = Logger.getLogger(ParserContext.class);

	private enum TokenKind {
		POSITIONAL, LONG_OPTION, SHORT_OPTION
	}

	private final ArgConfig theConfig;
	private final ArgumentSet theArgs;
	/** An option given without a value, which is taken from the next token */
	private OptionDefinition<?, ?> theWaitingForValue;
	private boolean areOptionsAvailable;
	private int theNextPositional;

	private ParserContext(ArgConfig config, ArgumentSet args) {
		theConfig = config;
		theArgs = args;
		areOptionsAvailable = true;
	}

	/**
	 * @param config The config for recognizing tokens
	 * @param args The arguments to parse for
	 * @param tokens The command-line tokens
	 * @throws ArgParsingException If the tokens cannot be parsed. Holders filled before the error keep their values.
	 */
	public static void parse(ArgConfig config, ArgumentSet args, List<String> tokens) throws ArgParsingException {
		if (args.isMutable())
			args = ArgumentSet.unmodifiable(args);
		new ParserContext(config, args).parse(tokens);
	}

	private void parse(List<String> tokens) throws ArgParsingException {
		if (log.isDebugEnabled())
			log.debug("Parsing " + tokens.size() + " token(s) against " + theArgs);
		for (int i = 0; i < tokens.size(); i++) {
			String token = tokens.get(i);
			if (theWaitingForValue != null) {
				fill(theWaitingForValue, token);
				theWaitingForValue = null;
				continue;
			}

			if (token.equals(theConfig.getDisableOptionsAfter())) {
				areOptionsAvailable = false;
				continue;
			}

			TokenKind kind = classify(token);
			switch (kind) {
			case POSITIONAL:
				if (!theArgs.getCommands().isEmpty()) {
					parseCommand(token, tokens.subList(i + 1, tokens.size()));
					return;
				}
				parsePositional(token);
				break;
			case LONG_OPTION:
				parseLongOption(token, token.substring(theConfig.getLongPrefix().length()));
				break;
			case SHORT_OPTION:
				parseShortOptions(token.substring(theConfig.getShortPrefix().length()));
				break;
			}
		}

		CommandSetDefinition<?> commandSet = theArgs.getCommandSet();
		if (commandSet != null && !commandSet.getValueHolder().isFilled())
			throw ArgParsingException.missingCommand();

		List<String> missing = new ArrayList<>();
		int p = theNextPositional;
		// The current positional may be multi-valued and already given
		while (p < theArgs.getPositionals().size() && theArgs.getPositionals().get(p).getValueHolder().wasGiven())
			p++;
		for (; p < theArgs.getPositionals().size(); p++) {
			PositionalDefinition<?, ?> positional = theArgs.getPositionals().get(p);
			if (!positional.getRequirement().isMandatory())
				break;
			missing.add(positional.getName());
		}
		if (!missing.isEmpty())
			throw ArgParsingException.missingPositionals(missing);

		if (theWaitingForValue != null)
			throw ArgParsingException.missingOptionValue(theWaitingForValue.getName());
	}

	private TokenKind classify(String token) {
		if (areOptionsAvailable) {
			if (token.startsWith(theConfig.getLongPrefix()))
				return TokenKind.LONG_OPTION;
			String shortPrefix = theConfig.getShortPrefix();
			// A bare short prefix is an empty cluster
			if (shortPrefix != null && token.startsWith(shortPrefix))
				return TokenKind.SHORT_OPTION;
		}
		return TokenKind.POSITIONAL;
	}

	private void parsePositional(String text) throws ArgParsingException {
		if (theNextPositional == theArgs.getPositionals().size())
			throw ArgParsingException.tooManyPositionals(text);

		PositionalDefinition<?, ?> positional = theArgs.getPositionals().get(theNextPositional);
		fill(positional, text);
		if (!positional.isMulti())
			theNextPositional++;

		Boolean noOptions = positional.getNoOptionsFollowing();
		if (noOptions != null ? noOptions : theConfig.isNoOptionsAfterPositional())
			areOptionsAvailable = false;
	}

	private void parseCommand(String text, List<String> remaining) throws ArgParsingException {
		CommandDefinition command = theArgs.getCommands().get(text);
		if (command == null)
			throw ArgParsingException.unknownCommand(text);
		fill(theArgs.getCommandSet(), text);
		if (log.isDebugEnabled())
			log.debug("Selected command " + text + ", parsing " + remaining.size() + " remaining token(s)");
		parse(theConfig, command.getArgs(), remaining);
	}

	private void parseLongOption(String token, String text) throws ArgParsingException {
		int equalIdx = text.indexOf('=');
		String name = equalIdx < 0 ? text : text.substring(0, equalIdx);
		String value = equalIdx < 0 ? null : text.substring(equalIdx + 1);

		OptionDefinition<?, ?> option = theArgs.getOption(name);
		if (option == null)
			throw ArgParsingException.unknownOption(token);

		if (value != null)
			fill(option, value);
		else if (option.isFlag())
			fillFlag(option, name.equals(option.getFlag().getInverse()));
		else
			theWaitingForValue = option;
	}

	private void parseShortOptions(String text) throws ArgParsingException {
		for (int i = 0; i < text.length(); i++) {
			char shortName = text.charAt(i);
			boolean isLast = i == text.length() - 1;
			OptionDefinition<?, ?> option = theArgs.getOptionByShort(shortName);
			if (option == null)
				throw ArgParsingException.unknownOption(theConfig.getShortPrefix() + shortName);

			if (option.isFlag() && (isLast || text.charAt(i + 1) != '=')) {
				// Inverses have no short alias
				fillFlag(option, false);
				continue;
			}

			// A valued option (or a flag followed by '=') takes the rest of the token
			if (isLast)
				theWaitingForValue = option;
			else {
				int valueStart = text.charAt(i + 1) == '=' ? i + 2 : i + 1;
				fill(option, text.substring(valueStart));
			}
			break;
		}
	}

	private void fillFlag(OptionDefinition<?, ?> option, boolean inverse) throws ArgParsingException {
		fill(option, String.valueOf(!inverse));
	}

	private static void fill(ValueTarget<?> target, String text) throws ArgParsingException {
		try {
			target.parseAndFill(text);
		} catch (ParseException | IllegalArgumentException e) {
			throw ArgParsingException.parsingValue(target.getName(), text, e.getMessage(), e);
		}
	}
}
