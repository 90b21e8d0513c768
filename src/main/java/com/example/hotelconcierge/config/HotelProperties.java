package com.example.hotelconcierge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Datos del hotel usados en el prompt del sistema y en las respuestas predefinidas.
 */
@ConfigurationProperties(prefix = "hotel")
public class HotelProperties {
    private String name = "Grand Hotel";
    private String phone = "+1234567890";
    private String email = "info@grandhotel.com";
    private String address = "123 Main St, City, State 12345";
    private String wifiNetwork = "GrandHotel_Guest";

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }

    public String getWifiNetwork() { return wifiNetwork; }
    public void setWifiNetwork(String wifiNetwork) { this.wifiNetwork = wifiNetwork; }
}
