package io.textimport.tsv;

import io.textimport.core.RecordConverter;
import io.textimport.core.StructuredDocument;
import io.textimport.error.ConversionException;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts one tab-separated line into a document. Dotted field names produce nested documents;
 * tokens past the end of the field list are named {@code field<i>} after their 0-based position.
 * Stateless.
 */
public class TsvRecordConverter implements RecordConverter<StructuredDocument> {
    static final String TOKEN_SEPARATOR = "\t";
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final TsvOptions options;

    public TsvRecordConverter(TsvOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public TsvOptions options() { return options; }

    @Override
    public StructuredDocument convert(List<String> fields, String payload, long index) throws ConversionException {
        String[] tokens = tokenize(payload);
        if (options.strictTokenCount() && tokens.length != fields.size()) {
            throw new ConversionException(index, "expected " + fields.size() + " field(s) but found "
                    + tokens.length + " in document #" + index);
        }
        StructuredDocument.Builder doc = StructuredDocument.builder();
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (options.ignoreBlanks() && token.isEmpty()) continue;
            Object value = options.inferTypes() ? parseValue(token) : token;
            if (i < fields.size()) {
                String name = fields.get(i);
                try {
                    doc.appendPath(name, value);
                } catch (IllegalArgumentException e) {
                    throw new ConversionException(index, e.getMessage() + " in document #" + index, e);
                }
            } else {
                String key = "field" + i;
                if (fields.contains(key)) {
                    throw new ConversionException(index, "duplicate field name - on " + key + " - for token #"
                            + (i + 1) + " ('" + value + "') in document #" + index);
                }
                doc.append(key, value);
            }
        }
        return doc.build();
    }

    static String[] tokenize(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) end--;
        return line.substring(0, end).split(TOKEN_SEPARATOR, -1);
    }

    static Object parseValue(String token) {
        if (!NUMBER.matcher(token).matches()) return token;
        if (INTEGER.matcher(token).matches()) {
            int digits = token.length() - (Character.isDigit(token.charAt(0)) ? 0 : 1);
            if (digits <= 18) {
                long v = Long.parseLong(token);
                if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) return (int) v;
                return v;
            }
        }
        return Double.parseDouble(token);
    }
}
