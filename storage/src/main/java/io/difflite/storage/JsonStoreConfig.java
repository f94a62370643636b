package io.difflite.storage;

/** JSON shape of {@link StoreConfig}; null fields take defaults. */
public class JsonStoreConfig {
    public String dataDir;
    public Long walRotateBytes;
    public Integer snapshotEveryCommits;
    public Boolean fsync;
}
