package common.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.TimeZone;

@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return eventObjectMapper();
    }

    /**
     * 事件序列化使用的 ObjectMapper
     * 非 Spring 管理的写入端（如仿真主循环直接 new 的 EventWriter）也通过这里获取同一套配置
     */
    public static ObjectMapper eventObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();

        //  时间模块 Instant 输出为 ISO-8601 字符串
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        objectMapper.configure(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE, false);
        objectMapper.setTimeZone(TimeZone.getTimeZone("UTC"));

        // 遇到 JSON 中有但 Bean 中没有的字段，不报错
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // 允许空 Bean
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        // 响应体中 null 字段不输出；事件信封自身通过注解保留 null 字段
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        return objectMapper;
    }
}
