package com.pagecraft.service.tree;

import io.micronaut.context.annotation.ConfigurationProperties;

@ConfigurationProperties("designer.tree")
public class TreeConfiguration {

    private String rootType = "container";
    private int historySize = ComponentTree.DEFAULT_HISTORY_SIZE;

    public String getRootType() { return rootType; }
    public void setRootType(String rootType) { this.rootType = rootType; }

    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
}
