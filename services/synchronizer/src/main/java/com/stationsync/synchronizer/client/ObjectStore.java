package com.stationsync.synchronizer.client;

import java.util.List;

public interface ObjectStore {

    /**
     * All keys starting with {@code prefix}, in provider order.
     */
    List<String> listKeys(String prefix);

    byte[] getObject(String key);
}
