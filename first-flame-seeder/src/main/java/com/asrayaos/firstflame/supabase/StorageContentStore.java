package com.asrayaos.firstflame.supabase;

/**
 * {@link ContentStore} reading from one Supabase Storage bucket.
 */
public class StorageContentStore implements ContentStore {

    private final SupabaseClient client;
    private final String bucket;

    public StorageContentStore(SupabaseClient client, String bucket) {
        this.client = client;
        this.bucket = bucket;
    }

    @Override
    public byte[] fetch(String key) throws SupabaseException {
        return client.download(bucket, key);
    }

    public String getBucket() {
        return bucket;
    }
}
