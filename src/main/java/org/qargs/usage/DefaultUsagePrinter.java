package org.qargs.usage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.qargs.ArgumentSet;
import org.qargs.CommandDefinition;
import org.qargs.Definition;
import org.qargs.OptionDefinition;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

/**
 * Prints a "Usage:" line summarizing a scope's arguments, followed in full mode by the prologue, the commands, positionals and options
 * in columns with their descriptions, each custom usage group, and the epilogue
 */
public class DefaultUsagePrinter implements UsagePrinter {
	/** The default line width */
	public static final int DEFAULT_WIDTH = 80;

	private static final String PADDING = "  ";

	private final int theWidth;
	private final TextWrapper theWrapper;

	/** Creates a printer wrapping at {@link #DEFAULT_WIDTH} */
	public DefaultUsagePrinter() {
		this(DEFAULT_WIDTH, TextWrapper.DEFAULT);
	}

	/**
	 * @param width The line width to wrap to, or 0 to not wrap
	 * @param wrapper The wrapper for long text
	 */
	public DefaultUsagePrinter(int width, TextWrapper wrapper) {
		if (width < 0)
			throw new IllegalArgumentException("Width must not be negative: " + width);
		theWidth = width;
		theWrapper = wrapper;
	}

	/** @return The line width, or 0 if text is not wrapped */
	public int getWidth() {
		return theWidth;
	}

	@Override
	public void print(ArgumentSet args, UsageInfo info, UsageContext context, Appendable sink, boolean shortUsage) throws IOException {
		List<Definition> commands = new ArrayList<>();
		List<Definition> positionals = new ArrayList<>();
		List<Definition> options = new ArrayList<>();
		Map<UsageGroup, List<Definition>> groups = new LinkedHashMap<>();
		for (Map.Entry<String, Definition> entry : args.allDefinitions(false)) {
			Definition definition = entry.getValue();
			if (definition.getUsageGroup() != null) {
				groups.computeIfAbsent(definition.getUsageGroup(), g -> new ArrayList<>()).add(definition);
				continue;
			}
			switch (definition.getKind()) {
			case COMMAND:
				commands.add(definition);
				break;
			case POSITIONAL:
				positionals.add(definition);
				break;
			case OPTION:
				options.add(definition);
				break;
			}
		}

		StringBuilder prefix = new StringBuilder("Usage: ");
		prefix.append(info.getApplication() == null ? "<this application>" : info.getApplication()).append(' ');
		for (CommandDefinition command : context.getPath())
			prefix.append(command.getName()).append(' ');
		writeLines(sink, wrap(prefix.append(buildUsageLine(args)).toString()));

		if (shortUsage)
			return;
		if (info.getPrologue() != null) {
			sink.append('\n');
			writeLines(sink, wrap(info.getPrologue()));
		}
		printGroup(sink, "Commands", commands);
		printGroup(sink, "Positional arguments", positionals);
		printGroup(sink, "Options", options);
		for (Map.Entry<UsageGroup, List<Definition>> group : groups.entrySet())
			printGroup(sink, group.getKey().getName(), group.getValue());
		sink.append('\n');
		if (info.getEpilogue() != null) {
			writeLines(sink, wrap(info.getEpilogue()));
			sink.append('\n');
		}
	}

	/**
	 * @param definition The definition to format
	 * @param inShortUsage Whether the definition is being formatted for the "Usage:" line
	 * @return The text representing the definition
	 */
	protected String format(Definition definition, boolean inShortUsage) {
		switch (definition.getKind()) {
		case COMMAND:
			return definition.getName();
		case POSITIONAL:
			return inShortUsage ? "<" + definition.getName() + ">" : definition.getName();
		default:
			break;
		}
		OptionDefinition<?, ?> option = (OptionDefinition<?, ?>) definition;
		StringBuilder str = new StringBuilder();
		if (option.getShortName() != null)
			str.append('-').append(option.getShortName()).append(inShortUsage ? "|" : ", ");
		str.append("--");
		if (!option.isFlag())
			str.append(option.getName()).append('=').append(option.getValueDescription() == null ? "VALUE" : option.getValueDescription());
		else {
			String inverse = option.getFlag().getInverse();
			str.append(inverse == null ? option.getName() : LongestCommonSubstring.of(option.getName(), inverse).toString());
			str.append("[=true|false]");
		}
		return inShortUsage ? "[" + str + "]" : str.toString();
	}

	private String buildUsageLine(ArgumentSet args) {
		List<String> parts = new ArrayList<>();
		if (!args.getCommands().isEmpty())
			parts.add("<command>");
		for (Map.Entry<String, Definition> entry : args.allDefinitions(false)) {
			if (entry.getValue().getKind() != Definition.Kind.COMMAND)
				parts.add(format(entry.getValue(), true));
		}
		return Joiner.on(' ').join(parts);
	}

	private void printGroup(Appendable sink, String groupName, List<Definition> contents) throws IOException {
		if (contents.isEmpty())
			return;
		sink.append('\n').append(groupName).append(":\n\n");

		List<String> strings = new ArrayList<>(contents.size());
		int longest = 0;
		for (Definition def : contents) {
			String str = format(def, false);
			strings.add(str);
			longest = Math.max(longest, str.length());
		}
		int argColumn = longest + PADDING.length() * 2;
		int descripWidth = 0;
		if (theWidth > 0 && theWidth - PADDING.length() - argColumn > 1)
			descripWidth = theWidth - PADDING.length() - argColumn;

		for (int i = 0; i < contents.size(); i++) {
			String str = strings.get(i);
			sink.append(PADDING).append(str);
			String description = contents.get(i).getDescription();
			if (description == null || description.isEmpty()) {
				sink.append('\n');
				continue;
			}
			sink.append(Strings.repeat(" ", longest - str.length())).append(PADDING);
			List<String> lines = descripWidth > 0 ? theWrapper.wrap(description, descripWidth) : Collections.singletonList(description);
			if (lines.isEmpty()) {
				sink.append('\n');
				continue;
			}
			sink.append(lines.get(0)).append('\n');
			for (int j = 1; j < lines.size(); j++)
				sink.append(Strings.repeat(" ", argColumn)).append(lines.get(j)).append('\n');
		}
	}

	private List<String> wrap(String text) {
		return theWidth > 0 ? theWrapper.wrap(text, theWidth) : Collections.singletonList(text);
	}

	private static void writeLines(Appendable sink, List<String> lines) throws IOException {
		sink.append(Joiner.on('\n').join(lines)).append('\n');
	}
}
