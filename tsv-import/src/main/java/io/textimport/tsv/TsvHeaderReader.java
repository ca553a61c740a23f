package io.textimport.tsv;

import io.textimport.source.DelimitedLineReader;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Reads field names from the first line of a TSV stream. */
public final class TsvHeaderReader {
    private TsvHeaderReader() {}

    public static List<String> read(DelimitedLineReader lines) throws IOException {
        Optional<String> header = lines.readLine();
        if (header.isEmpty()) throw new EOFException("input is empty; expected a header line");
        List<String> fields = new ArrayList<>();
        for (String f : TsvRecordConverter.tokenize(header.get())) {
            fields.add(f);
        }
        return FieldNames.validate(fields);
    }
}
