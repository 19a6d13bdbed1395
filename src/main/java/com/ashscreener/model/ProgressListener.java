package com.ashscreener.model;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);
}
