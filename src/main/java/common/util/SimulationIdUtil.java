package common.util;

import common.consts.ErrorCodes;
import common.exception.BusinessException;

import java.nio.file.Path;

/**
 * 仿真ID即输出根目录下的子目录名，写入端与查询端共用同一套校验
 */
public final class SimulationIdUtil {

    private SimulationIdUtil() {}

    public static boolean isValid(String simulationId) {
        return simulationId != null && !simulationId.isBlank()
                && !simulationId.contains("/") && !simulationId.contains("\\") && !simulationId.contains("..");
    }

    /**
     * 解析仿真目录，不允许跨出输出根目录
     */
    public static Path resolve(Path outputRoot, String simulationId) {
        if (!isValid(simulationId)) {
            throw new BusinessException(ErrorCodes.INVALID_SIMULATION_ID + ": " + simulationId);
        }
        return outputRoot.resolve(simulationId);
    }
}
