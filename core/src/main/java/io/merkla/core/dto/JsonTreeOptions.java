package io.merkla.core.dto;

public class JsonTreeOptions {
    public String hashAlgorithm;
    public Boolean sortPairs;
}
