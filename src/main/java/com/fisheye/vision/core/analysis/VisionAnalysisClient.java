package com.fisheye.vision.core.analysis;

/**
 * 视觉语言模型访问接口
 * <p>
 * 实现类自行处理超时与重试；服务端错误以 {@link AnalysisResult#failure(String)} 返回而不是抛出，
 * 保证单个视角失败不影响其他视角
 */
public interface VisionAnalysisClient {

    /**
     * @param jpeg   JPEG 编码的图像
     * @param prompt 提示词
     * @param model  模型标识，例如 gpt-4o
     */
    AnalysisResult analyze(byte[] jpeg, String prompt, String model);
}
