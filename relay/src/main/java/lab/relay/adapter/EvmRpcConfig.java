package lab.relay.adapter;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
public class EvmRpcConfig {

    // The per-call timeout bounds every submission attempt; the retry executor adds no deadline of its own.
    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(
            @Value("${relay.evm.rpc-url}") String rpcUrl,
            @Value("${relay.evm.call-timeout:10s}") Duration callTimeout,
            @Value("${relay.evm.proxy.enabled:false}") boolean proxyEnabled,
            @Value("${relay.evm.proxy.host:}") String proxyHost,
            @Value("${relay.evm.proxy.port:8080}") int proxyPort,
            @Value("${relay.evm.proxy.username:}") String proxyUsername,
            @Value("${relay.evm.proxy.password:}") String proxyPassword) {
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(callTimeout)
                .readTimeout(callTimeout)
                .writeTimeout(callTimeout)
                .callTimeout(callTimeout);

        if (proxyEnabled) {
            if (proxyHost == null || proxyHost.isBlank()) {
                throw new IllegalStateException("relay.evm.proxy.host must be configured when relay.evm.proxy.enabled=true");
            }
            clientBuilder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort)));

            if (proxyUsername != null && !proxyUsername.isBlank()) {
                clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                    String credential = okhttp3.Credentials.basic(proxyUsername, proxyPassword == null ? "" : proxyPassword);
                    Request request = response.request();
                    return request.newBuilder()
                            .header("Proxy-Authorization", credential)
                            .build();
                });
            }
        }

        return Web3j.build(new HttpService(rpcUrl, clientBuilder.build(), false));
    }
}
