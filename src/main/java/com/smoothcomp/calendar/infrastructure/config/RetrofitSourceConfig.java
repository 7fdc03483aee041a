package com.smoothcomp.calendar.infrastructure.config;

import com.smoothcomp.calendar.infrastructure.adapter.provider.SmoothcompApi;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.scalars.ScalarsConverterFactory;

import java.util.concurrent.TimeUnit;

@Configuration
public class RetrofitSourceConfig {

    @Bean
    public SmoothcompApi smoothcompApi(SmoothcompProperties properties) {
        return create(properties.getSource());
    }

    /**
     * Retrofit client returning raw page bodies. The call timeout bounds each page fetch.
     */
    public static SmoothcompApi create(SmoothcompProperties.Source source) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(source.getPageTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("User-Agent", source.getUserAgent())
                        .build()))
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(source.getBaseUrl())
                .client(httpClient)
                .addConverterFactory(ScalarsConverterFactory.create())
                .build();

        return retrofit.create(SmoothcompApi.class);
    }
}
