package com.pocket.obj;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Tree 条目类型：文件（blob）或子目录（tree）。 */
public enum EntryType {
    @JsonProperty("File")
    FILE,
    @JsonProperty("Tree")
    TREE
}
