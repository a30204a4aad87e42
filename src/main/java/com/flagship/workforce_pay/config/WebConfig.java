package com.flagship.workforce_pay.config;

import com.flagship.workforce_pay.attendance.AttendanceStatus;
import com.flagship.workforce_pay.identity.CallerIdentityArgumentResolver;
import com.flagship.workforce_pay.payment.PaymentRequestStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * MVC wiring: caller identity parameters and status query parameters given
 * by label ("Half Day") or by name ("HALF_DAY").
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CallerIdentityArgumentResolver());
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new AttendanceStatusConverter());
        registry.addConverter(new PaymentRequestStatusConverter());
    }

    static class AttendanceStatusConverter implements Converter<String, AttendanceStatus> {
        @Override
        public AttendanceStatus convert(String source) {
            return source.isBlank() ? null : AttendanceStatus.fromValue(source);
        }
    }

    static class PaymentRequestStatusConverter implements Converter<String, PaymentRequestStatus> {
        @Override
        public PaymentRequestStatus convert(String source) {
            return source.isBlank() ? null : PaymentRequestStatus.fromValue(source);
        }
    }
}
