package io.textimport.tsv;

/**
 * @param inferTypes       parse numeric tokens into Integer, Long or Double instead of keeping strings
 * @param strictTokenCount fail a record whose token count differs from the field count
 * @param ignoreBlanks     leave empty tokens out of the document
 */
public record TsvOptions(boolean inferTypes, boolean strictTokenCount, boolean ignoreBlanks) {
    public static TsvOptions defaults() { return new TsvOptions(false, false, false); }
}
