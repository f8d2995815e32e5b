package com.fisheye.vision.core.storage;

import java.util.List;

/**
 * 产物存储能力接口
 * <p>
 * 实现类负责自身的超时与重试：临时故障重试耗尽后抛出
 * {@link com.fisheye.vision.exception.TransientStorageException}，
 * 对象不存在时抛出 {@link com.fisheye.vision.exception.ArtifactNotFoundException}
 */
public interface ArtifactStorage {

    /**
     * 读取图像字节
     */
    byte[] getImage(String location);

    /**
     * 写入 JPEG 字节，返回规范化后的地址
     */
    String putImage(byte[] jpeg, String location);

    /**
     * 写入 JSON 文本，返回规范化后的地址
     */
    String putJson(String json, String location);

    String getText(String location);

    String putText(String text, String location);

    /**
     * 列出前缀下的对象地址（不递归）
     */
    List<String> list(String prefix);
}
