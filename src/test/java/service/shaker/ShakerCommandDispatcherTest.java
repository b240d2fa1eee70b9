package service.shaker;

import com.fasterxml.jackson.databind.JsonNode;
import common.consts.VialTargetEnum;
import common.exception.HomingRequiredException;
import common.exception.KlipperConnectionException;
import common.exception.KlipperResponseException;
import model.bo.DispatchResult;
import model.bo.MotionGeometry;
import model.bo.MotionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.klipper.impl.KlipperErrorLog;
import service.motion.GcodeEncoder;
import service.motion.MotionProfileCalculator;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 指令调度与自动归零恢复测试
 */
@DisplayName("指令调度测试")
class ShakerCommandDispatcherTest {

    private static final String SCRIPT = "G1 X105.0000 Y150.0000 F2000";
    private static final String HOMING_TEXT = "{\"error\": {\"message\": \"Must home axis first: 105.000 150.000 0.000 [0.000]\"}}";

    private RecordingKlipperApi klipper;
    private KlipperErrorLog errorLog;
    private GcodeEncoder encoder;
    private ShakerCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MotionGeometry geometry = MotionGeometry.defaults();
        klipper = new RecordingKlipperApi();
        errorLog = new KlipperErrorLog();
        encoder = new GcodeEncoder(geometry);
        dispatcher = new ShakerCommandDispatcher(klipper, new MotionProfileCalculator(geometry), encoder,
                geometry, errorLog);
    }

    @Test
    @DisplayName("直线模式只发送一次 不回原点")
    void testLinearDispatch() {
        DispatchResult result = dispatcher.dispatch(MotionRequest.linear(60, 1.0));

        assertEquals(1, klipper.sent.size());
        assertEquals(result.getScript(), klipper.sent.get(0));
        assertEquals(55, result.getGcodeLines());
        assertEquals("ok", result.getMoonrakerResponse().get("result").asText());
        assertNull(result.getHomeResponse());
    }

    @Test
    @DisplayName("轨道模式动作结束后单独发送回原点序列")
    void testOrbitalReturnsToOrigin() {
        DispatchResult result = dispatcher.dispatch(MotionRequest.orbital(60, 1.0, VialTargetEnum.TARGET_B));

        assertEquals(2, klipper.sent.size());
        assertEquals(result.getScript(), klipper.sent.get(0));
        assertEquals(encoder.encodeReturnToOrigin(MotionGeometry.defaults().origin()), klipper.sent.get(1));
        assertEquals(1, result.getHomeResponse().get("seq").asInt());
    }

    @Test
    @DisplayName("需要归零时: 原指令 -> G28 X Y -> M400 -> 重发 并返回重发结果")
    void testHomingRecovery() {
        klipper.failNext(new HomingRequiredException(400, HOMING_TEXT));

        JsonNode resp = dispatcher.sendWithHomingRecovery(SCRIPT, "TEST");

        assertEquals(List.of(SCRIPT, "G28 X Y", encoder.encodeWaitForMoves(), SCRIPT), klipper.sent);
        assertEquals("G28 X Y", GcodeEncoder.stripComment(klipper.sent.get(1)));
        assertEquals("M400", GcodeEncoder.stripComment(klipper.sent.get(2)));
        assertEquals(3, resp.get("seq").asInt(), "应该返回重发的响应");

        List<KlipperErrorLog.ErrorLogEntry> entries = errorLog.listAll();
        assertEquals(1, entries.size());
        assertEquals(KlipperErrorLog.ErrorType.HOMING_RECOVERY, entries.get(0).getErrorType());
        assertTrue(entries.get(0).getRecovered());
    }

    @Test
    @DisplayName("重发后再次要求归零时直接抛出 不再重试")
    void testSecondHomingFailurePropagates() {
        klipper.failNext(new HomingRequiredException(400, HOMING_TEXT))
                .succeedNext()
                .succeedNext()
                .failNext(new HomingRequiredException(400, HOMING_TEXT));

        assertThrows(HomingRequiredException.class, () -> dispatcher.sendWithHomingRecovery(SCRIPT, "TEST"));
        assertEquals(4, klipper.sent.size());
        assertFalse(errorLog.listAll().get(0).getRecovered());
    }

    @Test
    @DisplayName("其他控制器错误原样抛出 不触发归零")
    void testOtherErrorsPropagate() {
        KlipperResponseException error = new KlipperResponseException("G-code 指令发送失败", "KLIPPER_GCODE_ERROR",
                400, "Unknown command: \"G999\"");
        klipper.failNext(error);

        KlipperResponseException thrown = assertThrows(KlipperResponseException.class,
                () -> dispatcher.sendWithHomingRecovery(SCRIPT, "TEST"));
        assertSame(error, thrown);
        assertEquals(List.of(SCRIPT), klipper.sent);
        assertTrue(errorLog.listAll().isEmpty());
    }

    @Test
    @DisplayName("连接错误原样抛出")
    void testConnectionErrorPropagates() {
        klipper.failNext(new KlipperConnectionException("服务器连接失败", new IOException("Connection refused")));

        KlipperConnectionException thrown = assertThrows(KlipperConnectionException.class,
                () -> dispatcher.dispatch(MotionRequest.helical(60, 1.0)));
        assertEquals(503, thrown.getHttpStatus());
        assertEquals(1, klipper.sent.size());
    }

    @Test
    @DisplayName("归零指令本身失败时抛出该错误")
    void testHomingCommandFailure() {
        klipper.failNext(new HomingRequiredException(400, HOMING_TEXT))
                .failNext(new KlipperConnectionException("服务器连接失败", new IOException("timeout")));

        assertThrows(KlipperConnectionException.class, () -> dispatcher.sendWithHomingRecovery(SCRIPT, "TEST"));
        assertEquals(List.of(SCRIPT, "G28 X Y"), klipper.sent);
    }

    @Test
    @DisplayName("轨道模式回原点时同样执行归零恢复")
    void testOrbitalOriginRecovery() {
        klipper.succeedNext()
                .failNext(new HomingRequiredException(400, HOMING_TEXT));

        DispatchResult result = dispatcher.dispatch(MotionRequest.orbital(60, 1.0, VialTargetEnum.TARGET_A));

        String origin = encoder.encodeReturnToOrigin(MotionGeometry.defaults().origin());
        assertEquals(List.of(result.getScript(), origin, "G28 X Y", encoder.encodeWaitForMoves(), origin), klipper.sent);
        assertEquals(0, result.getMoonrakerResponse().get("seq").asInt());
        assertEquals(4, result.getHomeResponse().get("seq").asInt());
    }

    @Test
    @DisplayName("归零错误文本匹配不区分大小写")
    void testHomingMarker() {
        assertTrue(HomingRequiredException.matches("Must home axis first: 0.000 0.000"));
        assertTrue(HomingRequiredException.matches("MUST HOME X"));
        assertFalse(HomingRequiredException.matches("Move out of range"));
        assertFalse(HomingRequiredException.matches(null));
    }
}
