package org.javai.bulkops.gate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic classifier for bulk control messages.
 *
 * <p>A message is {@link BulkIntent#CONTINUE} or {@link BulkIntent#CANCEL} only when,
 * after lower-casing and stripping punctuation, it consists entirely of phrases from
 * one closed set (plus the filler word "please"). "Yes, go ahead" continues and
 * "Stop please" cancels; "yes but stop", "go to my inbox" and "I don't know" are
 * {@link BulkIntent#UNRELATED}.</p>
 */
public class BulkIntentClassifier {

	private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}'\\s]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern QUOTES = Pattern.compile("^'+|'+$");

	static final Set<String> CONTINUE_PHRASES = Set.of(
			"continue", "yes", "proceed", "go", "go ahead", "next", "keep going", "resume",
			"ok", "okay", "sure", "yep", "yeah", "do it");

	static final Set<String> CANCEL_PHRASES = Set.of(
			"cancel", "stop", "abort", "no", "halt", "quit", "end", "don't", "do not",
			"never mind", "nevermind", "no thanks");

	private static final Set<String> FILLER = Set.of("please");

	// longest phrases first so "go ahead" wins over "go"
	private static final List<String[]> CONTINUE_TOKENS = tokenize(CONTINUE_PHRASES);
	private static final List<String[]> CANCEL_TOKENS = tokenize(CANCEL_PHRASES);

	public BulkIntent classify(String message) {
		if (message == null) {
			return BulkIntent.UNRELATED;
		}
		String[] words = words(message);
		if (words.length == 0) {
			return BulkIntent.UNRELATED;
		}
		if (consistsOf(words, CONTINUE_TOKENS)) {
			return BulkIntent.CONTINUE;
		}
		if (consistsOf(words, CANCEL_TOKENS)) {
			return BulkIntent.CANCEL;
		}
		return BulkIntent.UNRELATED;
	}

	public boolean isContinue(String message) {
		return classify(message) == BulkIntent.CONTINUE;
	}

	public boolean isCancel(String message) {
		return classify(message) == BulkIntent.CANCEL;
	}

	private static String[] words(String message) {
		String cleaned = PUNCTUATION.matcher(message.toLowerCase(Locale.ROOT).replace('\u2019', '\''))
				.replaceAll(" ");
		List<String> words = new ArrayList<>();
		for (String word : WHITESPACE.split(cleaned)) {
			// quotes around a word, as in: say 'continue'
			String stripped = QUOTES.matcher(word).replaceAll("");
			if (!stripped.isEmpty()) {
				words.add(stripped);
			}
		}
		return words.toArray(new String[0]);
	}

	private static boolean consistsOf(String[] words, List<String[]> phrases) {
		int i = 0;
		boolean matchedPhrase = false;
		while (i < words.length) {
			if (FILLER.contains(words[i])) {
				i++;
				continue;
			}
			int matched = longestMatch(words, i, phrases);
			if (matched == 0) {
				return false;
			}
			matchedPhrase = true;
			i += matched;
		}
		return matchedPhrase;
	}

	private static int longestMatch(String[] words, int start, List<String[]> phrases) {
		for (String[] phrase : phrases) {
			if (start + phrase.length > words.length) {
				continue;
			}
			boolean match = true;
			for (int j = 0; j < phrase.length; j++) {
				if (!phrase[j].equals(words[start + j])) {
					match = false;
					break;
				}
			}
			if (match) {
				return phrase.length;
			}
		}
		return 0;
	}

	private static List<String[]> tokenize(Set<String> phrases) {
		List<String[]> tokens = new ArrayList<>();
		for (String phrase : phrases) {
			tokens.add(phrase.split(" "));
		}
		tokens.sort(Comparator.comparingInt((String[] t) -> t.length).reversed());
		return List.copyOf(tokens);
	}
}
