package cn.hjw.dev.seqflow.item;

public enum CombineKind {
    AVE,
    SUM,
    RMS
}
