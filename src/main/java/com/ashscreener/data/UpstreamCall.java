package com.ashscreener.data;

import com.ashscreener.model.Table;

@FunctionalInterface
public interface UpstreamCall {
    Table call() throws Exception;
}
