package it.aw.annotator.llm;

/**
 * Ritrova nel testo di un chunk un frammento restituito dal modello di chat.
 * Prima ricerca esatta, poi case-insensitive; le virgolette esterne vengono tolte.
 */
final class TextLocator {

    private TextLocator() {}

    static String clean(String fragment) {
        if (fragment == null) return "";
        String s = fragment.trim();
        while (s.length() > 1 && isQuote(s.charAt(0)) && isQuote(s.charAt(s.length() - 1))) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    /** @return indice del frammento nel testo, -1 se assente */
    static int locate(String text, String fragment) {
        if (fragment.isEmpty()) return -1;
        int idx = text.indexOf(fragment);
        if (idx >= 0) return idx;
        // regionMatches lavora sul testo originale: gli indici restano validi
        // anche quando il lowercase cambierebbe la lunghezza (es. 'İ')
        for (int i = 0; i + fragment.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, fragment, 0, fragment.length())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '“' || c == '”';
    }
}
