package com.example.navireader.morph.dictionary;

import java.util.List;

/**
 * Origin of dictionary records: a file, a remote service, a database.
 */
public interface LexiconSource {

    /**
     * @return all records the source could read, possibly empty
     */
    List<LexicalRecord> load();
}
