package com.wordduel.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations on the partially revealed rendering of a secret word. A mask always has the word's length;
 * revealed positions carry the word's original-case character.
 */
public final class Mask {
    public static final char PLACEHOLDER = '_';

    private Mask() {}

    public static String hidden(String word) {
        return String.valueOf(PLACEHOLDER).repeat(word.length());
    }

    public static boolean isSolved(String mask) {
        return mask.indexOf(PLACEHOLDER) < 0;
    }

    public static List<Integer> hiddenPositions(String mask) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < mask.length(); i++) {
            if (mask.charAt(i) == PLACEHOLDER) positions.add(i);
        }
        return positions;
    }

    /**
     * Reveals every hidden position whose character matches {@code letter} ignoring case.
     */
    public static String revealAll(String word, String mask, char letter) {
        char needle = Character.toLowerCase(letter);
        char[] out = mask.toCharArray();
        for (int i = 0; i < word.length(); i++) {
            if (Character.toLowerCase(word.charAt(i)) == needle) {
                out[i] = word.charAt(i);
            }
        }
        return new String(out);
    }

    /**
     * Reveals only the first still-hidden position matching {@code letter}.
     */
    public static String revealFirst(String word, String mask, char letter) {
        char needle = Character.toLowerCase(letter);
        for (int i = 0; i < word.length(); i++) {
            if (mask.charAt(i) == PLACEHOLDER && Character.toLowerCase(word.charAt(i)) == needle) {
                return revealAt(word, mask, i);
            }
        }
        return mask;
    }

    public static String revealAt(String word, String mask, int index) {
        char[] out = mask.toCharArray();
        out[index] = word.charAt(index);
        return new String(out);
    }
}
